package com.esgcredit.runner;

import com.esgcredit.config.Config;
import com.esgcredit.core.EsgCreditException;
import com.esgcredit.core.InsufficientHistoryException;
import com.esgcredit.core.ValidationException;
import com.esgcredit.core.diagnostics.CauseCode;
import com.esgcredit.core.diagnostics.Outcome;
import com.esgcredit.feature.FeatureBuilder;
import com.esgcredit.forecast.ForecastModel;
import com.esgcredit.forecast.TrainedModel;
import com.esgcredit.matching.LoanTerms;
import com.esgcredit.matching.LoanTermsCalculator;
import com.esgcredit.matching.ProductMatcher;
import com.esgcredit.matching.UpgradeSimulation;
import com.esgcredit.model.CompanyProfile;
import com.esgcredit.model.FeatureVector;
import com.esgcredit.model.ForecastResult;
import com.esgcredit.model.Grade;
import com.esgcredit.model.HistoricalSeries;
import com.esgcredit.model.MatchResult;
import com.esgcredit.model.PipelineResult;
import com.esgcredit.model.ProductSpec;
import com.esgcredit.model.ScopeAggregate;
import com.esgcredit.model.ScoreBreakdown;
import com.esgcredit.model.SeriesPoint;
import com.esgcredit.scoring.ScoreEngine;
import com.esgcredit.supply.SupplyChainAnalyzer;
import com.esgcredit.utils.StepTimer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 模块说明：EsgPipeline（class）。
 * 主要职责：串联供应链汇总、评分、特征构建、训练预测与产品匹配，输出单个企业的完整结果。
 * 使用建议：组件异常转换为带 CauseCode 的 Outcome；预测失败时仍返回评分结果与不含预测的匹配结果。
 * 训练超时后线程不会被真正中断（森林在公共 fork-join 池上建树），因此每次限时训练都使用独立的守护线程，
 * 见 {@link FitTimeLimiter}。
 */
public final class EsgPipeline {
    private static final Logger LOG = LogManager.getLogger(EsgPipeline.class);

    private final SupplyChainAnalyzer supplyChainAnalyzer;
    private final ScoreEngine scoreEngine;
    private final FeatureBuilder featureBuilder;
    private final ForecastModel forecastModel;
    private final ProductMatcher productMatcher;
    private final LoanTermsCalculator loanTermsCalculator;
    private final FitTimeLimiter fitLimiter;

    public EsgPipeline(
            SupplyChainAnalyzer supplyChainAnalyzer,
            ScoreEngine scoreEngine,
            FeatureBuilder featureBuilder,
            ForecastModel forecastModel,
            ProductMatcher productMatcher,
            LoanTermsCalculator loanTermsCalculator,
            FitTimeLimiter fitLimiter
    ) {
        this.supplyChainAnalyzer = supplyChainAnalyzer;
        this.scoreEngine = scoreEngine;
        this.featureBuilder = featureBuilder;
        this.forecastModel = forecastModel;
        this.productMatcher = productMatcher;
        this.loanTermsCalculator = loanTermsCalculator;
        this.fitLimiter = fitLimiter;
    }

    /**
     * Pipeline fitting on the calling thread, without a time bound.
     */
    public static EsgPipeline fromConfig(Config config) {
        return fromConfig(config, false);
    }

    /**
     * With {@code boundedFit}, each fit runs on its own thread and is abandoned after
     * {@code pipeline.fit_timeout_sec}.
     */
    public static EsgPipeline fromConfig(Config config, boolean boundedFit) {
        FitTimeLimiter limiter = boundedFit
                ? new FitTimeLimiter(Math.max(1L, config.getLong("pipeline.fit_timeout_sec", 60L)) * 1000L)
                : null;
        return new EsgPipeline(
                SupplyChainAnalyzer.fromConfig(config),
                ScoreEngine.fromConfig(config),
                new FeatureBuilder(),
                ForecastModel.fromConfig(config),
                ProductMatcher.fromConfig(config),
                LoanTermsCalculator.fromConfig(config),
                limiter
        );
    }

/**
 * 方法说明：run，负责执行单个企业的完整流程。
 * 处理流程：aggregate → evaluate → build → fit → predict → match，评分结果作为最新一期追加到历史序列末尾。
 * 维护提示：输入校验失败返回 VALIDATION_FAILED；历史不足或训练超时只影响预测部分。
 */
    public Outcome<PipelineResult> run(CompanyProfile company, List<ProductSpec> catalog, int horizonMonths) {
        String name = company == null || company.indicators == null ? "" : company.name();
        StepTimer timer = new StepTimer();
        try {
            if (company == null || company.indicators == null) {
                throw new ValidationException(name, "company profile without indicators");
            }
            if (horizonMonths < 1) {
                throw new ValidationException(name, "horizon must be >= 1, got " + horizonMonths);
            }

            timer.start(StepTimer.AGGREGATE);
            ScopeAggregate supply = supplyChainAnalyzer.aggregate(company.suppliers);
            timer.end(StepTimer.AGGREGATE);

            timer.start(StepTimer.EVALUATE);
            ScoreBreakdown score = scoreEngine.evaluate(company.indicators, supply.riskPropagation);
            timer.end(StepTimer.EVALUATE);

            Outcome<ForecastResult> forecast = forecast(company, score, horizonMonths, timer);

            timer.start(StepTimer.MATCH);
            List<MatchResult> matches = productMatcher.match(score, forecast.value, catalog);
            List<LoanTerms> loans = new ArrayList<>();
            if (company.targetLoanAmount > 0.0) {
                for (MatchResult match : productMatcher.eligibleOnly(matches)) {
                    loans.add(loanTermsCalculator.calculate(match, company.targetLoanAmount));
                }
            }
            Grade next = score.grade.better();
            UpgradeSimulation upgrade = next == null
                    ? null
                    : productMatcher.simulateUpgrade(score, forecast.value, catalog, next);
            timer.end(StepTimer.MATCH);

            LOG.info("pipeline done: company={} total={} grade={} forecast={} eligible={}/{} {}",
                    name, score.total, score.grade, forecast.success ? "ok" : forecast.causeCode,
                    productMatcher.eligibleOnly(matches).size(), matches.size(), timer.summaryText());
            return Outcome.success(PipelineResult.builder()
                    .company(name)
                    .supplyChain(supply)
                    .score(score)
                    .forecast(forecast.value)
                    .forecastCause(forecast.causeCode)
                    .forecastMessage(forecast.message)
                    .matches(matches)
                    .loanTerms(List.copyOf(loans))
                    .upgrade(upgrade)
                    .timingsMs(timer.snapshot())
                    .build(), name);
        } catch (ValidationException e) {
            LOG.warn("pipeline rejected company={}: {}", name, e.getMessage());
            return Outcome.failure(CauseCode.VALIDATION_FAILED, name, e.getMessage(), Map.of("subject", e.subject()));
        } catch (EsgCreditException e) {
            LOG.warn("pipeline failed company={}: {}", name, e.getMessage());
            return Outcome.failure(CauseCode.RUNTIME_ERROR, name, e.getMessage(), Map.of("subject", e.subject()));
        } catch (RuntimeException e) {
            LOG.warn("pipeline failed company={}", name, e);
            return Outcome.failure(CauseCode.RUNTIME_ERROR, name, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private Outcome<ForecastResult> forecast(CompanyProfile company, ScoreBreakdown score, int horizonMonths, StepTimer timer) {
        String name = company.name();
        try {
            timer.start(StepTimer.FEATURES);
            FeatureVector features = featureBuilder.build(withLatestScore(company.history, score));
            timer.end(StepTimer.FEATURES);

            timer.start(StepTimer.FIT);
            TrainedModel model = fit(name, features);
            timer.end(StepTimer.FIT);

            timer.start(StepTimer.PREDICT);
            ForecastResult result = forecastModel.predict(model, horizonMonths);
            timer.end(StepTimer.PREDICT);
            return Outcome.success(result, name);
        } catch (InsufficientHistoryException e) {
            LOG.warn("forecast skipped company={}: {}", name, e.getMessage());
            return Outcome.failure(CauseCode.HISTORY_SHORT, name, e.getMessage(), Map.of(
                    "available", e.available(),
                    "required", e.required()
            ));
        } catch (TimeoutException e) {
            LOG.warn("forecast fit timed out company={} after {}ms", name, fitLimiter.timeoutMillis());
            return Outcome.failure(CauseCode.FIT_TIMEOUT, name, "fit exceeded " + fitLimiter.timeoutMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(CauseCode.FIT_INTERRUPTED, name, "fit interrupted");
        }
    }

    private TrainedModel fit(String name, FeatureVector features) throws InterruptedException, TimeoutException {
        if (fitLimiter == null) {
            return forecastModel.fit(features);
        }
        try {
            return fitLimiter.call(name, () -> forecastModel.fit(features));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new EsgCreditException(name, "fit failed: " + cause, cause);
        }
    }

    /**
     * History with the evaluated score appended as the month after its last period.
     */
    static HistoricalSeries withLatestScore(HistoricalSeries history, ScoreBreakdown score) {
        if (history == null || history.isEmpty()) {
            return history == null ? new HistoricalSeries(score.company, List.of()) : history;
        }
        return history.append(new SeriesPoint(
                history.last().period.plusMonths(1),
                score.environmental,
                score.social,
                score.governance
        ));
    }
}

package com.esgcredit.runner;

import com.esgcredit.config.Config;
import com.esgcredit.core.diagnostics.CauseCode;
import com.esgcredit.core.diagnostics.Outcome;
import com.esgcredit.model.CompanyProfile;
import com.esgcredit.model.PipelineResult;
import com.esgcredit.model.ProductSpec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * 模块说明：BatchRunner（class）。
 * 主要职责：在固定大小的线程池上并行执行多个企业的流程，训练步骤在各自的守护线程上受超时约束。
 * 使用建议：单个企业失败（包括目录中格式错误的条目）不影响其余企业；结果顺序与输入顺序一致。
 */
public final class BatchRunner {
    private static final Logger LOG = LogManager.getLogger(BatchRunner.class);

    private final int threads;
    private final EsgPipeline pipeline;

    public BatchRunner(Config config) {
        this.threads = Math.max(1, config.getInt("pipeline.threads", 4));
        this.pipeline = EsgPipeline.fromConfig(config, true);
    }

    public List<Outcome<PipelineResult>> runAll(List<CompanyProfile> companies, List<ProductSpec> catalog, int horizonMonths)
            throws InterruptedException {
        List<Outcome<CompanyProfile>> entries = new ArrayList<>();
        if (companies != null) {
            for (int i = 0; i < companies.size(); i++) {
                CompanyProfile company = companies.get(i);
                String name = company == null || company.indicators == null ? "companies[" + i + "]" : company.name();
                entries.add(Outcome.success(company, name));
            }
        }
        return runEntries(entries, catalog, horizonMonths);
    }

/**
 * 方法说明：runEntries，负责按目录条目逐个执行流程。
 * 处理流程：解析失败的条目原样转为失败结果（保留 CauseCode、企业标识与明细），其余条目提交到线程池执行。
 * 维护提示：返回列表与输入条目一一对应。
 */
    public List<Outcome<PipelineResult>> runEntries(
            List<Outcome<CompanyProfile>> entries,
            List<ProductSpec> catalog,
            int horizonMonths
    ) throws InterruptedException {
        int total = entries == null ? 0 : entries.size();
        if (total == 0) {
            return List.of();
        }
        @SuppressWarnings("unchecked")
        Outcome<PipelineResult>[] ordered = new Outcome[total];
        int failed = 0;
        int submitted = 0;
        long startedNanos = System.nanoTime();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(threads, total));
        CompletionService<IndexedOutcome> completion = new ExecutorCompletionService<>(pool);
        try {
            for (int i = 0; i < total; i++) {
                Outcome<CompanyProfile> entry = entries.get(i);
                if (entry.failed()) {
                    ordered[i] = Outcome.failure(entry.causeCode, entry.owner, entry.message, entry.details);
                    failed++;
                    continue;
                }
                int index = i;
                CompanyProfile company = entry.value;
                completion.submit(() -> new IndexedOutcome(index, pipeline.run(company, catalog, horizonMonths)));
                submitted++;
            }

            for (int i = 0; i < submitted; i++) {
                Future<IndexedOutcome> future = completion.take();
                try {
                    IndexedOutcome result = future.get();
                    ordered[result.index] = result.outcome;
                    if (result.outcome.failed()) {
                        failed++;
                    }
                } catch (ExecutionException e) {
                    failed++;
                    LOG.error("company task crashed: {}", String.valueOf(e.getCause()));
                }
            }
        } finally {
            pool.shutdown();
        }

        for (int i = 0; i < total; i++) {
            if (ordered[i] == null) {
                ordered[i] = Outcome.failure(CauseCode.RUNTIME_ERROR, entries.get(i).owner, "task did not complete");
            }
        }
        LOG.info("batch done: companies={} failed={} elapsed={}ms",
                total, failed, (System.nanoTime() - startedNanos) / 1_000_000L);
        return new ArrayList<>(Arrays.asList(ordered));
    }

    private static final class IndexedOutcome {
        private final int index;
        private final Outcome<PipelineResult> outcome;

        private IndexedOutcome(int index, Outcome<PipelineResult> outcome) {
            this.index = index;
            this.outcome = outcome;
        }
    }
}

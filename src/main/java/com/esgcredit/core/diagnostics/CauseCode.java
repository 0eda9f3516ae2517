package com.esgcredit.core.diagnostics;

/**
 * 模块说明：CauseCode（enum）。
 * 主要职责：承载 diagnostics 模块 的关键逻辑，对外提供可复用的调用入口。
 * 使用建议：修改该类型时应同步关注上下游调用，避免影响整体流程稳定性。
 */
public enum CauseCode {
    NONE,
    VALIDATION_FAILED,
    HISTORY_SHORT,
    FIT_TIMEOUT,
    FIT_INTERRUPTED,
    RUNTIME_ERROR
}

package com.fastguard.core.failure;

import com.fastguard.core.spi.failure.FailureCaseHandler;
import com.fastguard.core.spi.failure.FailureDecider;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 按异常类型把失败路由给 {@link FailureCaseHandler}
 * <p>
 * 沿 cause 链由外向内查找, 每一层取继承距离最近的处理器; 整条链都没有匹配时返回默认决策
 */
public class RouterFailureDecider implements FailureDecider {

    /** cause 链最大展开层数, 防止自引用链死循环 */
    private static final int MAX_CAUSE_DEPTH = 32;

    private final List<FailureCaseHandler<?>> routes;

    private final Decision fallback;

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers) {
        this(handlers, Decision.of(Outcome.RETRY, Category.UNKNOWN).withCode("UNHANDLED"));
    }

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers, Decision fallback) {
        this.routes = handlers == null ? List.of() : new ArrayList<>(new LinkedHashSet<>(handlers));
        this.fallback = fallback;
    }

    @Override
    public Decision decide(Throwable t) {
        Throwable current = t;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            FailureCaseHandler<?> route = closestRoute(current);
            if (route != null) {
                return dispatch(route, current);
            }
            Throwable next = current.getCause();
            current = next == current ? null : next;
        }
        return fallback;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Decision dispatch(FailureCaseHandler route, Throwable e) {
        return route.execute(e);
    }

    private FailureCaseHandler<?> closestRoute(Throwable e) {
        FailureCaseHandler<?> best = null;
        int bestDepth = Integer.MAX_VALUE;
        for (FailureCaseHandler<?> candidate : routes) {
            if (!candidate.supports(e)) {
                continue;
            }
            int depth = inheritanceDepth(e.getClass(), candidate.exceptionType());
            if (best == null || depth < bestDepth) {
                best = candidate;
                bestDepth = depth;
            }
        }
        return best;
    }

    /** 子类到父类的继承层数, 不在同一继承链上返回 Integer.MAX_VALUE */
    private static int inheritanceDepth(Class<?> type, Class<?> ancestor) {
        int depth = 0;
        for (Class<?> c = type; c != null; c = c.getSuperclass(), depth++) {
            if (c.equals(ancestor)) {
                return depth;
            }
        }
        return Integer.MAX_VALUE;
    }
}

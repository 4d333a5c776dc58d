package com.fastguard.core.breaker;

/**
 * 状态迁移监听, 在熔断器锁外回调
 */
@FunctionalInterface
public interface CircuitTransitionListener {

    void onTransition(CircuitTransition transition);
}

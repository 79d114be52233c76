package com.edtech.auth.support;

import com.edtech.auth.config.AuthProperties;
import com.edtech.auth.exception.BusinessException;
import com.edtech.auth.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 外部调用执行器。
 * <p>
 * 密码哈希、存储访问与通知发送都经由独立线程池执行，并带有按类别配置的超时：
 * - 超时：取消任务并抛出 {@link ErrorCode#TIMEOUT}；
 * - 存储异常（{@link DataAccessException}）：{@link ErrorCode#SERVICE_UNAVAILABLE}；
 * - 业务异常：原样透传；
 * - 其他异常：原样透传，由编排层边界统一记录并映射为内部错误。
 * 不做自动重试。
 */
@Slf4j
@Component
public class BoundedCallRunner {

    private final AsyncTaskExecutor executor;
    private final AuthProperties.Timeouts timeouts;

    public BoundedCallRunner(@Qualifier("authCallExecutor") AsyncTaskExecutor executor, AuthProperties properties) {
        this.executor = executor;
        this.timeouts = properties.getTimeouts();
    }

    public <T> T hash(String operation, Callable<T> call) {
        return run(operation, timeouts.getHash(), call);
    }

    public <T> T store(String operation, Callable<T> call) {
        return run(operation, timeouts.getStore(), call);
    }

    public void storeRun(String operation, Runnable call) {
        run(operation, timeouts.getStore(), () -> {
            call.run();
            return null;
        });
    }

    public <T> T notification(String operation, Callable<T> call) {
        return run(operation, timeouts.getNotification(), call);
    }

    /**
     * 在线程池上执行调用并等待至多 {@code timeout}。
     *
     * @param operation 操作名，仅用于日志。
     * @param timeout   超时上限。
     * @param call      实际调用。
     * @return 调用结果。
     * @throws BusinessException 超时、存储不可用或线程池拒绝时抛出。
     */
    public <T> T run(String operation, Duration timeout, Callable<T> call) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException ex) {
            log.warn("Auth call rejected op={} reason={}", operation, ex.getMessage());
            throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, ErrorCode.SERVICE_UNAVAILABLE.getDefaultMessage(), ex);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Auth call timed out op={} timeoutMs={}", operation, timeout.toMillis());
            throw new BusinessException(ErrorCode.TIMEOUT, ErrorCode.TIMEOUT.getDefaultMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, ErrorCode.SERVICE_UNAVAILABLE.getDefaultMessage(), ex);
        } catch (ExecutionException ex) {
            throw translate(operation, ex.getCause());
        }
    }

    private RuntimeException translate(String operation, Throwable cause) {
        if (cause instanceof BusinessException business) {
            return business;
        }
        if (cause instanceof DataAccessException) {
            log.error("Auth store failure op={}", operation, cause);
            return new BusinessException(ErrorCode.SERVICE_UNAVAILABLE, ErrorCode.SERVICE_UNAVAILABLE.getDefaultMessage(), cause);
        }
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException("Auth call failed: " + operation, cause);
    }
}

package com.hrplatform.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.context.annotation.Configuration;
import org.springframework.stereotype.Component;

/**
 * Performance Monitoring Configuration.
 *
 * Tracks latency of:
 * - Cryptographic operations (crypto.operation)
 * - Sensitive-field processing (sensitive.processing)
 * - Authorization checks (security.authorization)
 *
 * Security: No sensitive data in metrics. Tags carry method names and outcomes only.
 */
@Configuration
@Slf4j
public class PerformanceConfiguration {

    /**
     * Aspect for timing crypto operations.
     */
    @Aspect
    @Component
    public static class CryptoPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public CryptoPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.hrplatform.infrastructure.crypto.CryptoService.*(..))")
        public Object timeCryptoOperation(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, joinPoint, "crypto.operation", "Cryptographic operation timing");
        }
    }

    /**
     * Aspect for timing sensitive-field processing.
     */
    @Aspect
    @Component
    public static class SensitiveProcessingAspect {

        private final MeterRegistry meterRegistry;

        public SensitiveProcessingAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(public * com.hrplatform.infrastructure.security.SensitiveFieldProcessor.process*(..))")
        public Object timeProcessing(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, joinPoint, "sensitive.processing", "Sensitive field processing timing");
        }
    }

    /**
     * Aspect for timing security operations.
     */
    @Aspect
    @Component
    public static class SecurityPerformanceAspect {

        private final MeterRegistry meterRegistry;

        public SecurityPerformanceAspect(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
        }

        @Around("execution(* com.hrplatform.infrastructure.security.SecurityKernel.authorize*(..))")
        public Object timeSecurityCheck(ProceedingJoinPoint joinPoint) throws Throwable {
            return timed(meterRegistry, joinPoint, "security.authorization", "Authorization check timing");
        }
    }

    static Object timed(MeterRegistry meterRegistry,
                        ProceedingJoinPoint joinPoint,
                        String metricName,
                        String description) throws Throwable {
        String methodName = joinPoint.getSignature().toShortString();

        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            Object result = joinPoint.proceed();
            sample.stop(Timer.builder(metricName)
                .tag("method", methodName)
                .tag("outcome", "success")
                .description(description)
                .register(meterRegistry));
            return result;

        } catch (Exception e) {
            sample.stop(Timer.builder(metricName)
                .tag("method", methodName)
                .tag("outcome", "failure")
                .description(description)
                .register(meterRegistry));
            throw e;
        }
    }
}

package com.starscape.mediacatalog.common.persistence;

import com.starscape.mediacatalog.common.exception.StorageException;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * Turns storage failures escaping a registry into {@link StorageException}.
 * Runs outside the transaction advice so that commit failures are caught too.
 */
@Aspect
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class StorageExceptionTranslator {

    private static final Logger log = LoggerFactory.getLogger(StorageExceptionTranslator.class);

    @Around("within(com.starscape.mediacatalog.features..app.*) && execution(public * *(..))")
    public Object translate(ProceedingJoinPoint joinPoint) throws Throwable {
        try {
            return joinPoint.proceed();
        } catch (DataAccessException | TransactionException e) {
            log.error("Storage operation {} failed: {}", joinPoint.getSignature().toShortString(), e.getMessage(), e);
            throw new StorageException("Storage operation failed: " + e.getMessage(), e);
        }
    }
}

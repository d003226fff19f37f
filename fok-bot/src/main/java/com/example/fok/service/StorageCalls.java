package com.example.fok.service;

import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import java.util.function.Supplier;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.TransactionException;

/**
 * Maps persistence failures onto service error codes. Integrity violations pass through untouched so callers can
 * resolve duplicate inserts themselves.
 */
final class StorageCalls {

    private StorageCalls() {
    }

    static <T> T call(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataIntegrityViolationException ex) {
            throw ex;
        } catch (OptimisticLockingFailureException ex) {
            throw new ServiceException(ErrorCode.CONFLICT, "Record was modified concurrently", ex);
        } catch (DataAccessException | TransactionException ex) {
            throw new ServiceException(ErrorCode.STORAGE_UNAVAILABLE, "Primary store unavailable", ex);
        }
    }
}

package com.example.securevote.service;

import com.example.securevote.model.Result;
import com.example.securevote.model.VoteError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs one atomic step of the voting core. A failed {@link Result} rolls the transaction back,
 * and so does any storage error, which is reported as STORAGE_UNAVAILABLE: nothing is partially
 * committed either way.
 */
@Component
@Slf4j
public class UnitOfWork {

    private final TransactionTemplate transactionTemplate;

    public UnitOfWork(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> Result<T> execute(String operation, Supplier<Result<T>> work) {
        try {
            return transactionTemplate.execute(status -> {
                Result<T> result = work.get();
                if (result.isFailure()) {
                    status.setRollbackOnly();
                }
                return result;
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("{} rolled back, storage unavailable: {}", operation, e.getMessage());
            return Result.failure(VoteError.STORAGE_UNAVAILABLE);
        }
    }
}

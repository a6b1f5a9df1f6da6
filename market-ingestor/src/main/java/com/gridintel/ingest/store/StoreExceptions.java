package com.gridintel.ingest.store;

import com.gridintel.ingest.exception.IngestException;
import com.gridintel.ingest.exception.StoreConnectionException;
import com.gridintel.ingest.exception.StoreConstraintViolationException;
import com.gridintel.ingest.exception.StoreWriteTimeoutException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * Translates Spring's data-access exceptions into the ingestion error taxonomy.
 */
final class StoreExceptions {

    private StoreExceptions() {
    }

    static IngestException translate(String action, RuntimeException e) {
        String message = action + " failed: " + e.getMessage();
        if (e instanceof QueryTimeoutException || e instanceof TransactionTimedOutException) {
            return new StoreWriteTimeoutException(message, e);
        }
        if (e instanceof DataIntegrityViolationException) {
            return new StoreConstraintViolationException(message, e);
        }
        if (e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessResourceException
                || e instanceof RecoverableDataAccessException
                || e instanceof CannotCreateTransactionException) {
            return new StoreConnectionException(message, e);
        }
        if (e instanceof DataAccessException || e instanceof TransactionException) {
            return new IngestException(message, e);
        }
        if (e instanceof IngestException) {
            return (IngestException) e;
        }
        return new IngestException(message, e);
    }
}

/*
 * Copyright 2026 the EventLedger authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.eventledger.eventstore.jdbc.internal;

import org.eventledger.eventstore.api.OptimisticLockException;
import org.eventledger.eventstore.api.PersistenceConnectionException;
import org.eventledger.eventstore.api.PersistenceException;
import org.eventledger.eventstore.api.StorageProtocolViolationException;
import org.eventledger.eventstore.api.UnknownPersistenceException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.dao.TypeMismatchDataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.IncorrectResultSetColumnCountException;
import org.springframework.jdbc.InvalidResultSetAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.sql.BatchUpdateException;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTransientConnectionException;

/**
 * Translates failures from the JDBC driver (usually already wrapped in Spring's {@code DataAccessException} hierarchy by {@code JdbcTemplate})
 * into a {@link PersistenceException} of exactly one kind, or into a {@link StorageProtocolViolationException}.
 */
public class JdbcExceptionTranslator {

    // SQL:2003 "unique violation" (PostgreSQL, H2) and MySQL's ER_DUP_ENTRY
    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";
    private static final int MYSQL_DUPLICATE_ENTRY_ERROR_CODE = 1062;
    private static final String CONNECTION_EXCEPTION_SQL_STATE_CLASS = "08";
    private static final String SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION_SQL_STATE_CLASS = "42";

    private JdbcExceptionTranslator() {
    }

    /**
     * Translate an exception thrown by Spring JDBC or Spring transaction management.
     *
     * @param description A short description of what was being done, such as "append events to aggregate 123"
     * @param e           The exception to translate
     * @return The translated exception. Exceptions that are already translated are returned as is.
     */
    public static RuntimeException translateException(String description, RuntimeException e) {
        if (e instanceof PersistenceException || e instanceof StorageProtocolViolationException) {
            return e;
        } else if (e instanceof DuplicateKeyException) {
            return new OptimisticLockException(description + " failed since a concurrent write won: " + e.getMessage(), e);
        } else if (e instanceof BadSqlGrammarException
                || e instanceof InvalidResultSetAccessException
                || e instanceof IncorrectResultSetColumnCountException
                || e instanceof TypeMismatchDataAccessException) {
            return new StorageProtocolViolationException(description + " failed since the database schema doesn't match what's expected: " + e.getMessage(), e);
        } else if (e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessResourceException
                || e instanceof CannotCreateTransactionException) {
            return new PersistenceConnectionException(description + " failed since the database couldn't be reached: " + e.getMessage(), e);
        }

        SQLException sqlException = findSqlException(e);
        if (sqlException == null) {
            return new UnknownPersistenceException(description + " failed: " + e, e);
        }
        return translateSqlException(description, sqlException, e);
    }

    /**
     * Translate a raw {@link SQLException} from the JDBC driver, by SQL state and vendor error code.
     *
     * @param description A short description of what was being done
     * @param e           The exception to translate
     * @return The translated exception
     */
    public static RuntimeException translateException(String description, SQLException e) {
        return translateSqlException(description, e, e);
    }

    private static RuntimeException translateSqlException(String description, SQLException e, Throwable cause) {
        SQLException mostSpecific = mostSpecific(e);
        String sqlState = mostSpecific.getSQLState();
        if (UNIQUE_VIOLATION_SQL_STATE.equals(sqlState) || mostSpecific.getErrorCode() == MYSQL_DUPLICATE_ENTRY_ERROR_CODE) {
            return new OptimisticLockException(description + " failed since a concurrent write won: " + mostSpecific.getMessage(), cause);
        } else if (mostSpecific instanceof SQLTransientConnectionException
                || mostSpecific instanceof SQLNonTransientConnectionException
                || hasSqlStateClass(sqlState, CONNECTION_EXCEPTION_SQL_STATE_CLASS)) {
            return new PersistenceConnectionException(description + " failed since the database couldn't be reached: " + mostSpecific.getMessage(), cause);
        } else if (hasSqlStateClass(sqlState, SYNTAX_ERROR_OR_ACCESS_RULE_VIOLATION_SQL_STATE_CLASS)) {
            return new StorageProtocolViolationException(description + " failed since the database schema doesn't match what's expected: " + mostSpecific.getMessage(), cause);
        } else {
            return new UnknownPersistenceException(description + " failed (SQL state " + sqlState + ", error code " + mostSpecific.getErrorCode() + "): " + mostSpecific.getMessage(), cause);
        }
    }

    private static SQLException findSqlException(Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof SQLException) {
                return (SQLException) current;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    // Batch updates report the actual failure as the "next" exception
    private static SQLException mostSpecific(SQLException e) {
        if (e instanceof BatchUpdateException && e.getNextException() != null) {
            return e.getNextException();
        }
        return e;
    }

    private static boolean hasSqlStateClass(String sqlState, String sqlStateClass) {
        return sqlState != null && sqlState.startsWith(sqlStateClass);
    }
}

package com.artgrid.config;

import org.hibernate.community.dialect.SQLiteDialect;
import org.hibernate.exception.ConstraintViolationException;
import org.hibernate.exception.spi.SQLExceptionConversionDelegate;

/**
 * SQLite dialect that reports constraint failures as {@link ConstraintViolationException}.
 *
 * sqlite-jdbc sets no SQLState, so without this a duplicate like or a foreign key
 * failure surfaces as a generic JDBC error instead of a data integrity violation.
 * Busy and locked errors keep the stock mapping to lock acquisition failures.
 */
public class ArtgridSQLiteDialect extends SQLiteDialect {

    // Primary result code; extended codes (2067 unique, 787 foreign key) share the low byte
    private static final int SQLITE_CONSTRAINT = 19;

    @Override
    public SQLExceptionConversionDelegate buildSQLExceptionConversionDelegate() {
        SQLExceptionConversionDelegate standard = super.buildSQLExceptionConversionDelegate();
        return (sqlException, message, sql) -> {
            if ((sqlException.getErrorCode() & 0xFF) == SQLITE_CONSTRAINT) {
                String constraintName = getViolatedConstraintNameExtractor().extractConstraintName(sqlException);
                return new ConstraintViolationException(message, sqlException, sql, constraintName);
            }
            return standard != null ? standard.convert(sqlException, message, sql) : null;
        };
    }
}

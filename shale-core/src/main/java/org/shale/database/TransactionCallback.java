package org.shale.database;

import java.sql.SQLException;

@FunctionalInterface
public interface TransactionCallback<T> {
    T doInTransaction(Database database) throws SQLException;
}

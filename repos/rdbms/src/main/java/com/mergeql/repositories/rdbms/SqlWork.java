package com.mergeql.repositories.rdbms;

import java.sql.SQLException;

@FunctionalInterface
public interface SqlWork<T> {
    T run() throws SQLException;
}

package com.evidex.core.dao;

import org.jdbi.v3.sqlobject.statement.SqlQuery;

public interface DatabaseDao {

    @SqlQuery("SELECT H2VERSION()")
    String engineVersion();

    @SqlQuery("SELECT 1")
    int ping();
}

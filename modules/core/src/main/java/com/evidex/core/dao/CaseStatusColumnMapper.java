package com.evidex.core.dao;

import com.evidex.types.CaseStatus;
import org.jdbi.v3.core.mapper.ColumnMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.ResultSet;
import java.sql.SQLException;

public class CaseStatusColumnMapper implements ColumnMapper<CaseStatus> {

    @Override
    public CaseStatus map(ResultSet r, int columnNumber, StatementContext ctx) throws SQLException {
        String label = r.getString(columnNumber);
        return label == null ? null : CaseStatus.fromLabel(label);
    }
}

package com.evidex.core.dao;

import com.evidex.types.CaseStatus;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class CaseStatusArgumentFactory extends AbstractArgumentFactory<CaseStatus> {

    public CaseStatusArgumentFactory() {
        super(Types.VARCHAR);
    }

    @Override
    protected Argument build(CaseStatus value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.label());
    }
}

package com.evidex.core.dao;

import com.evidex.types.EvidenceCategory;
import org.jdbi.v3.core.argument.AbstractArgumentFactory;
import org.jdbi.v3.core.argument.Argument;
import org.jdbi.v3.core.config.ConfigRegistry;

import java.sql.Types;

public class EvidenceCategoryArgumentFactory extends AbstractArgumentFactory<EvidenceCategory> {

    public EvidenceCategoryArgumentFactory() {
        super(Types.VARCHAR);
    }

    @Override
    protected Argument build(EvidenceCategory value, ConfigRegistry config) {
        return (position, statement, ctx) -> statement.setString(position, value.label());
    }
}

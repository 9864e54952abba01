package com.modelcraft.validation;

import com.modelcraft.database.DatabaseConnector;

/**
 * Implemented by rules that query the database. {@link ValidationRuleFactory} hands them the
 * connector right after instantiation.
 */
public interface DatabaseAware {

    void setDatabaseConnector(DatabaseConnector connector);
}

package com.di.querybench.load;

import lombok.Value;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;

/** Parameterized INSERT for one table together with the binder for its row payload. */
@Value
public class InsertStatement<T> {
    String                                 sql;
    ParameterizedPreparedStatementSetter<T> binder;
}

package com.di.querybench.load.generator;

import com.di.querybench.model.Account;

public class AccountGenerator implements RowGenerator<Account> {

    private final long count;

    public AccountGenerator(long count) {
        this.count = count;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public Account generate(long index) {
        checkIndex(index);
        long id = index + 1;
        return new Account(id, "Account_" + id);
    }
}

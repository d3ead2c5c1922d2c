package com.dayplanner.service;

import com.dayplanner.domain.enums.AccountKind;

public interface AccessTokenProvider {

    boolean isLinked(AccountKind account);

    String accessToken(AccountKind account);
}

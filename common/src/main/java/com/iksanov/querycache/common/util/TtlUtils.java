package com.iksanov.querycache.common.util;

import com.iksanov.querycache.common.exception.InvalidTtlException;

import java.time.Duration;

public final class TtlUtils {

    private TtlUtils() {}

    public static Duration requirePositive(Duration ttl) {
        if (ttl == null) throw new InvalidTtlException("ttl is null");
        if (ttl.isZero() || ttl.isNegative()) throw new InvalidTtlException("ttl must be positive, got " + ttl);
        return ttl;
    }
}

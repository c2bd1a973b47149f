package com.hcltech.kpc.common;

/** Wall-clock source, swappable in tests. */
public interface ITimeService {
    long currentTimeMillis();

    ITimeService real = System::currentTimeMillis;

    static ITimeService fixed(long fixedTimeMillis) {
        return () -> fixedTimeMillis;
    }
}

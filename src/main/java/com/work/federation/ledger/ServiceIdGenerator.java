package com.work.federation.ledger;

import java.time.Clock;

/**
 * 服务 id："service" + 纪元秒。同一进程同一秒内多次生成时追加递增后缀，保证进程内唯一。
 */
public class ServiceIdGenerator {

    private static final String PREFIX = "service";

    private final Clock clock;
    private long lastSecond = -1L;
    private int sequence;

    public ServiceIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public synchronized String next() {
        long second = clock.instant().getEpochSecond();
        if (second == lastSecond) {
            sequence++;
            return PREFIX + second + "-" + sequence;
        }
        lastSecond = second;
        sequence = 0;
        return PREFIX + second;
    }
}

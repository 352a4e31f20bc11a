package com.kmg.batch.service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

class RecordingSleeper implements Sleeper {
    final List<Duration> sleeps = new ArrayList<>();

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
    }
}

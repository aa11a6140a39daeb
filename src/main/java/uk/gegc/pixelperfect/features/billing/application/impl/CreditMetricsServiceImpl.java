package uk.gegc.pixelperfect.features.billing.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.billing.application.CreditMetricsService;

import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class CreditMetricsServiceImpl implements CreditMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter insufficientCreditsCounter;
    private final Counter refundFailedCounter;

    public CreditMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.insufficientCreditsCounter = Counter.builder("credits.debit.insufficient")
                .description("Debits rejected for insufficient balance")
                .register(meterRegistry);
        this.refundFailedCounter = Counter.builder("credits.refund.failed")
                .description("Refunds that could not be written to the ledger")
                .register(meterRegistry);
    }

    @Override
    public void incrementCreditsDebited(long amount, String backendId) {
        log.debug("METRIC: credits.debited amount={} backend={}", amount, backendId);
        Counter.builder("credits.debited")
                .description("Credits debited for processing jobs")
                .tag("backend", backendId)
                .register(meterRegistry)
                .increment(amount);
    }

    @Override
    public void incrementCreditsRefunded(long amount, String backendId) {
        log.debug("METRIC: credits.refunded amount={} backend={}", amount, backendId);
        Counter.builder("credits.refunded")
                .description("Credits refunded after failed processing jobs")
                .tag("backend", backendId)
                .register(meterRegistry)
                .increment(amount);
    }

    @Override
    public void incrementInsufficientCredits() {
        insufficientCreditsCounter.increment();
    }

    @Override
    public void incrementRefundFailed() {
        refundFailedCounter.increment();
    }

    @Override
    public void incrementJobCompleted(String backendId) {
        Counter.builder("dispatch.jobs.completed")
                .tag("backend", backendId)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void incrementJobFailed(String backendId, String errorCode) {
        Counter.builder("dispatch.jobs.failed")
                .tag("backend", backendId)
                .tag("code", errorCode)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordBackendLatency(String backendId, long latencyMs) {
        Timer.builder("dispatch.backend.latency")
                .description("Backend call latency including retries")
                .tag("backend", backendId)
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }
}

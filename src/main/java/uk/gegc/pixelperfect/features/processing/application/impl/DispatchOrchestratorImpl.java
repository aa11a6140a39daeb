package uk.gegc.pixelperfect.features.processing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import uk.gegc.pixelperfect.features.billing.application.CreditLedgerClient;
import uk.gegc.pixelperfect.features.billing.application.CreditMetricsService;
import uk.gegc.pixelperfect.features.billing.application.DebitResult;
import uk.gegc.pixelperfect.features.billing.application.JobIdGenerator;
import uk.gegc.pixelperfect.features.billing.domain.exception.InsufficientCreditsException;
import uk.gegc.pixelperfect.features.model.domain.model.BackendDescriptor;
import uk.gegc.pixelperfect.features.processing.application.DispatchOrchestrator;
import uk.gegc.pixelperfect.features.processing.application.DispatchRequest;
import uk.gegc.pixelperfect.features.processing.application.OutputNormalizer;
import uk.gegc.pixelperfect.features.processing.application.ProcessingErrorNormalizer;
import uk.gegc.pixelperfect.features.processing.domain.exception.ProcessingException;
import uk.gegc.pixelperfect.features.processing.domain.model.CanonicalResult;
import uk.gegc.pixelperfect.features.processing.domain.model.JobState;
import uk.gegc.pixelperfect.features.processing.domain.model.ProcessingErrorCode;
import uk.gegc.pixelperfect.features.processing.domain.model.ProcessingJob;
import uk.gegc.pixelperfect.features.processing.domain.model.ProcessingOutcome;
import uk.gegc.pixelperfect.features.processing.infra.backend.BackendCallExecutor;
import uk.gegc.pixelperfect.features.processing.infra.input.ModelInputBuilderRegistry;

import java.time.Clock;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchOrchestratorImpl implements DispatchOrchestrator {

    private final CreditLedgerClient ledgerClient;
    private final JobIdGenerator jobIdGenerator;
    private final ModelInputBuilderRegistry inputBuilders;
    private final BackendCallExecutor backendCallExecutor;
    private final OutputNormalizer outputNormalizer;
    private final ProcessingErrorNormalizer errorNormalizer;
    private final CreditMetricsService metricsService;
    private final Clock clock;

    @Override
    public ProcessingOutcome dispatch(DispatchRequest request) {
        BackendDescriptor backend = request.backend();
        String jobId = jobIdGenerator.generate(backend.providerKind());
        ProcessingJob job = new ProcessingJob(jobId, request.userId(), backend, request.creditCost());

        MDC.put("jobId", jobId);
        try {
            return run(job, request);
        } finally {
            MDC.remove("jobId");
        }
    }

    private ProcessingOutcome run(ProcessingJob job, DispatchRequest request) {
        BackendDescriptor backend = job.getBackend();
        log.info("Dispatching job {} to {} for user {} ({} credits)",
                job.getJobId(), backend.id(), job.getUserId(), job.getCreditCost());

        // CREATED -> DEBITED
        DebitResult debit;
        try {
            debit = ledgerClient.debit(job.getUserId(), job.getCreditCost(), job.getJobId(),
                    describe(request));
        } catch (InsufficientCreditsException ex) {
            job.transitionTo(JobState.FAILED);
            return ProcessingOutcome.failure(
                    new ProcessingException(ProcessingErrorCode.INSUFFICIENT_CREDITS, ex.getMessage(), ex), job);
        } catch (RuntimeException ex) {
            log.error("Ledger debit failed for job {}", job.getJobId(), ex);
            job.transitionTo(JobState.FAILED);
            return ProcessingOutcome.failure(
                    new ProcessingException(ProcessingErrorCode.GENERIC, "Failed to debit credits", ex), job);
        }
        job.transitionTo(JobState.DEBITED);
        metricsService.incrementCreditsDebited(job.getCreditCost(), backend.id());

        // DEBITED -> CALLING_BACKEND -> COMPLETED | FAILED
        long started = clock.millis();
        CanonicalResult result;
        try {
            job.transitionTo(JobState.CALLING_BACKEND);
            Map<String, Object> backendInput = inputBuilders.builderFor(backend.id()).build(request.input(), backend);
            Object rawOutput = backendCallExecutor.call(backend, backendInput, job.getJobId());
            result = outputNormalizer.normalize(rawOutput);
        } catch (RuntimeException ex) {
            ProcessingException error = errorNormalizer.normalize(ex);
            log.warn("Job {} failed on {}: {} {}", job.getJobId(), backend.id(), error.getCode(), error.getMessage());
            if (job.getState() == JobState.DEBITED) {
                job.transitionTo(JobState.CALLING_BACKEND);
            }
            job.transitionTo(JobState.FAILED);
            metricsService.incrementJobFailed(backend.id(), error.getCode().name());
            refund(job);
            return ProcessingOutcome.failure(error, job);
        } finally {
            metricsService.recordBackendLatency(backend.id(), clock.millis() - started);
        }

        job.transitionTo(JobState.COMPLETED);
        metricsService.incrementJobCompleted(backend.id());
        long elapsed = clock.millis() - started;
        log.info("Job {} completed on {} in {} ms", job.getJobId(), backend.id(), elapsed);
        return ProcessingOutcome.success(
                result.withBilling(backend.id(), job.getJobId(), job.getCreditCost(), debit.newBalance(), elapsed),
                job);
    }

    /**
     * FAILED -> REFUNDED. Reached whether or not the ledger accepts the refund.
     */
    private void refund(ProcessingJob job) {
        try {
            ledgerClient.refund(job.getUserId(), job.getCreditCost(), job.getJobId());
            metricsService.incrementCreditsRefunded(job.getCreditCost(), job.getBackend().id());
        } catch (RuntimeException refundError) {
            metricsService.incrementRefundFailed();
            log.error("Refund of {} credits failed for job {} user {}; manual reconciliation required",
                    job.getCreditCost(), job.getJobId(), job.getUserId(), refundError);
        }
        job.transitionTo(JobState.REFUNDED);
    }

    private static String describe(DispatchRequest request) {
        return "Image " + request.input().mode().toValue() + " " + request.input().scale() + "x with "
                + request.backend().id();
    }
}

package com.kmg.batch.service;

import com.kmg.batch.config.BatchProperties;
import com.kmg.batch.model.BatchJob;
import com.kmg.batch.model.CostEstimate;
import com.kmg.batch.model.CostRecord;
import com.kmg.batch.model.CostSummary;
import com.kmg.batch.model.RequestCounts;
import com.kmg.batch.repo.CostRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Estimates and records batch spend. Estimates use average token counts per request and the
 * configured per-model pricing with the batch discount applied.
 */
@Service
public class CostService {
    private static final Logger log = LoggerFactory.getLogger(CostService.class);
    private static final BatchProperties.Pricing DEFAULT_PRICING = new BatchProperties.Pricing(0.15, 0.60);

    private final CostRepository costRepository;
    private final BatchProperties properties;
    private final TimeService timeService;

    public CostService(CostRepository costRepository, BatchProperties properties, TimeService timeService) {
        this.costRepository = costRepository;
        this.properties = properties;
        this.timeService = timeService;
    }

    public CostEstimate estimate(int numRequests, String model) {
        BatchProperties.Costs costs = properties.getCosts();
        long inputTokens = (long) numRequests * costs.getAvgInputTokens();
        long outputTokens = (long) numRequests * costs.getAvgOutputTokens();

        BatchProperties.Pricing pricing = pricingFor(model);
        double regularCost = inputTokens / 1_000_000.0 * pricing.getInput()
                + outputTokens / 1_000_000.0 * pricing.getOutput();
        double batchCost = regularCost * costs.getBatchDiscount();
        return new CostEstimate(numRequests, model, inputTokens, outputTokens, regularCost, batchCost,
                regularCost - batchCost, costs.getBatchDiscount());
    }

    /**
     * Records the estimated spend of a completed job. The cost ledger is auxiliary: a write
     * failure is logged and does not fail the job.
     */
    public void recordJob(BatchJob job, String model, int submittedRequests, RequestCounts counts) {
        CostEstimate estimate = estimate(submittedRequests, model);
        CostRecord record = new CostRecord(
                0L,
                job.getName(),
                job.getProviderBatchId(),
                model,
                submittedRequests,
                counts == null ? 0 : counts.completed(),
                estimate.inputTokens(),
                estimate.outputTokens(),
                estimate.regularCost(),
                estimate.batchCost(),
                estimate.savings(),
                timeService.now()
        );
        try {
            costRepository.insert(record);
            log.info("[{}] recorded estimated cost ${} for {} requests", job.getName(),
                    String.format(Locale.ROOT, "%.4f", estimate.batchCost()), submittedRequests);
        } catch (DataAccessException e) {
            log.warn("[{}] failed to record cost: {}", job.getName(), e.getMessage());
        }
    }

    public CostSummary summary() {
        return costRepository.summarize();
    }

    public List<CostRecord> records() {
        return costRepository.findAll();
    }

    private BatchProperties.Pricing pricingFor(String model) {
        BatchProperties.Costs costs = properties.getCosts();
        BatchProperties.Pricing pricing = costs.getPricing().get(model);
        if (pricing != null) {
            return pricing;
        }
        log.debug("No pricing for model {}, using {}", model, costs.getFallbackModel());
        return costs.getPricing().getOrDefault(costs.getFallbackModel(), DEFAULT_PRICING);
    }
}

package com.researchplatform.webresearch.service;

import com.researchplatform.webresearch.dto.CreditProjection;
import com.researchplatform.webresearch.dto.UsageReport;
import com.researchplatform.webresearch.dto.UsageSummary;
import com.researchplatform.webresearch.metrics.AggregatedMetrics;
import com.researchplatform.webresearch.metrics.ResearchMetricsCollector;
import com.researchplatform.webresearch.ratelimit.TokenBucketRateLimiter;
import com.researchplatform.webresearch.resilience.ResilientRequestExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;

/** Read-mostly operator view over metrics, caches, limiter and breakers. */
@Service
public class ResearchUsageService {

    private static final Logger log = LoggerFactory.getLogger(ResearchUsageService.class);

    private static final int DAYS_PER_MONTH = 30;

    private final ResearchMetricsCollector metrics;
    private final WebResearchClient client;
    private final TokenBucketRateLimiter rateLimiter;
    private final ResilientRequestExecutor executor;
    private final Clock clock;
    private final double costPerCredit;
    private final double monthlyCreditPlan;

    public ResearchUsageService(ResearchMetricsCollector metrics,
                                WebResearchClient client,
                                TokenBucketRateLimiter rateLimiter,
                                ResilientRequestExecutor executor,
                                Clock researchClock,
                                @Value("${research.usage.cost-per-credit:0.05}") double costPerCredit,
                                @Value("${research.usage.monthly-credit-plan:4000}") double monthlyCreditPlan) {
        this.metrics           = metrics;
        this.client            = client;
        this.rateLimiter       = rateLimiter;
        this.executor          = executor;
        this.clock             = researchClock;
        this.costPerCredit     = costPerCredit;
        this.monthlyCreditPlan = monthlyCreditPlan;
    }

    public UsageReport buildReport() {
        AggregatedMetrics m = metrics.getMetrics();
        int total = m.totalRequests();

        double cacheHitRate = total > 0 ? (m.cacheHits() * 100.0) / total : 0.0;
        double successRate  = total > 0 ? (m.successfulRequests() * 100.0) / total : 0.0;
        double avgCost      = total > 0 ? (m.totalCreditsEstimated() / total) * costPerCredit : 0.0;

        UsageSummary summary = new UsageSummary(total, m.totalCreditsEstimated(), cacheHitRate, successRate, avgCost);
        return new UsageReport(
            clock.instant(),
            summary,
            m,
            project(m.totalCreditsEstimated()),
            client.getCacheStats(),
            rateLimiter.getStatus(),
            executor.getCircuitBreakerStatus(),
            metrics.generateMetricsReport()
        );
    }

    public String textReport() {
        return metrics.generateMetricsReport();
    }

    public void resetMetrics() {
        metrics.clear();
        log.info("[Usage] Metrics reset");
    }

    public void resetCircuitBreakers() {
        executor.resetCircuitBreakers();
        log.info("[Usage] Circuit breakers reset");
    }

    CreditProjection project(double windowCredits) {
        double daily   = windowCredits;
        double monthly = daily * DAYS_PER_MONTH;
        return new CreditProjection(
            costPerCredit,
            monthlyCreditPlan,
            daily,
            monthly,
            Math.max(0.0, monthlyCreditPlan - monthly),
            windowCredits * costPerCredit,
            daily * costPerCredit,
            monthly * costPerCredit
        );
    }
}

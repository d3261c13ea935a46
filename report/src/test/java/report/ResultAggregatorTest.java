package report;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ResultAggregatorTest {

    @Test
    void testSummaryCounts() {
        ResultAggregator aggregator = new ResultAggregator();
        aggregator.add(ReportFixtures.successfulFtp());
        aggregator.addAll(List.of(ReportFixtures.failedSftp(), ReportFixtures.failedSftp()));

        ProbeReport report = aggregator.toReport(ReportFixtures.GENERATED_AT);

        assertEquals(new ReportSummary(3, 1, 2), report.getSummary());
        assertEquals(ReportFixtures.GENERATED_AT, report.getGeneratedAt());
        assertFalse(report.isEmpty());
    }

    @Test
    void testSnapshotIsNotAffectedByLaterAdds() {
        ResultAggregator aggregator = new ResultAggregator();
        aggregator.add(ReportFixtures.successfulFtp());
        ProbeReport report = aggregator.toReport();

        aggregator.add(ReportFixtures.failedSftp());

        assertEquals(1, report.getResults().size());
        assertEquals(2, aggregator.size());
    }

    @Test
    void testConcurrentAdds() throws InterruptedException {
        ResultAggregator aggregator = new ResultAggregator();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 200; i++) {
            executor.submit(() -> aggregator.add(ReportFixtures.failedSftp()));
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(200, aggregator.size());
    }
}

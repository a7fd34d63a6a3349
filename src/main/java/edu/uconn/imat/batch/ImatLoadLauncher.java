package edu.uconn.imat.batch;

import edu.uconn.imat.common.exception.LoadJobFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Launches the load job for an input directory and turns anything short of
 * COMPLETED into a {@link LoadJobFailedException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ImatLoadLauncher {

    private final JobLauncher jobLauncher;

    private final Job imatLoadJob;

    public JobExecution launch(Path directory) throws JobExecutionException {
        String dir = directory.toAbsolutePath().normalize().toString();
        // every run is a new job instance; re-running is how a split is repaired
        JobParameters parameters = new JobParametersBuilder()
            .addString(ImatLoadJobConfiguration.DIR_PARAMETER, dir)
            .addString("run.id", UUID.randomUUID().toString())
            .toJobParameters();

        log.info("Loading iMAT data from {}", dir);
        JobExecution execution = jobLauncher.run(imatLoadJob, parameters);
        if (execution.getStatus() != BatchStatus.COMPLETED) {
            List<Throwable> failures = execution.getAllFailureExceptions();
            throw new LoadJobFailedException(execution.getStatus(), failures.isEmpty() ? null : failures.get(0));
        }
        log.info("Load finished in {}", Duration.between(
            execution.getStartTime(), execution.getEndTime()));
        return execution;
    }
}

package edu.uconn.imat.batch;

import edu.uconn.imat.config.LoaderProperties;
import edu.uconn.imat.service.LabelMapLoader;
import edu.uconn.imat.service.LoadSummaryService;
import edu.uconn.imat.service.SchemaInitializer;
import edu.uconn.imat.service.SplitLoader;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.builder.SimpleJobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Defines the load job: schema, label map, then four steps per split in the
 * configured order, then a summary.
 *
 * <p>Steps run under a {@link ResourcelessTransactionManager}: the JDBC work
 * inside them autocommits statement by statement instead of being held in
 * one step-wide transaction.
 */
@Configuration
public class ImatLoadJobConfiguration {

    public static final String JOB_NAME = "imatLoadJob";

    /**
     * Job parameter holding the absolute input directory
     */
    public static final String DIR_PARAMETER = "imat.dir";

    private final PlatformTransactionManager autocommit = new ResourcelessTransactionManager();

    @Bean
    public Job imatLoadJob(JobRepository jobRepository,
                           SchemaInitializer schemaInitializer,
                           LabelMapLoader labelMapLoader,
                           SplitLoader splitLoader,
                           LoadSummaryService loadSummaryService,
                           LoaderProperties properties) {
        SimpleJobBuilder job = new JobBuilder(JOB_NAME, jobRepository)
            .start(step(jobRepository, "initializeSchema", (contribution, context) -> {
                schemaInitializer.initialize();
                return RepeatStatus.FINISHED;
            }))
            .next(step(jobRepository, "loadLabelMap", (contribution, context) -> {
                long rows = labelMapLoader.load(inputDir(context).resolve(properties.getLabelMapFile()));
                contribution.incrementWriteCount(rows);
                return RepeatStatus.FINISHED;
            }));

        for (LoaderProperties.Split split : properties.getSplits()) {
            String name = split.getName();
            String file = split.getFile();
            for (SplitLoader.Phase phase : SplitLoader.Phase.values()) {
                job = job.next(step(jobRepository, name + "." + phase.getStepName(), (contribution, context) -> {
                    contribution.incrementWriteCount(splitLoader.run(phase, inputDir(context).resolve(file), name));
                    return RepeatStatus.FINISHED;
                }));
            }
        }

        List<String> splitNames = properties.getSplits().stream().map(LoaderProperties.Split::getName).toList();
        return job
            .next(step(jobRepository, "summary", (contribution, context) -> {
                loadSummaryService.summarize(splitNames);
                return RepeatStatus.FINISHED;
            }))
            .build();
    }

    private Step step(JobRepository jobRepository, String name, Tasklet tasklet) {
        return new StepBuilder(name, jobRepository)
            .tasklet(tasklet, autocommit)
            .allowStartIfComplete(true)
            .build();
    }

    private static Path inputDir(ChunkContext context) {
        Object dir = context.getStepContext().getJobParameters().get(DIR_PARAMETER);
        if (dir == null) {
            throw new IllegalStateException("Missing job parameter " + DIR_PARAMETER);
        }
        return Paths.get(dir.toString());
    }
}

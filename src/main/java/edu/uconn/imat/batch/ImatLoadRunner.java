package edu.uconn.imat.batch;

import edu.uconn.imat.config.LoaderProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.List;

/**
 * Runs the load at startup. The input directory is the single positional
 * argument when given, otherwise {@code imat.dir}.
 */
@Component
@ConditionalOnProperty(prefix = "imat", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class ImatLoadRunner implements ApplicationRunner {

    private final ImatLoadLauncher launcher;

    private final LoaderProperties properties;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> positional = args.getNonOptionArgs();
        if (positional.size() > 1) {
            throw new IllegalArgumentException("Expected at most one directory argument, got " + positional);
        }
        String dir = positional.isEmpty() ? properties.getDir() : positional.get(0);
        launcher.launch(Paths.get(dir));
    }
}

package com.tomopipe.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomopipe.process.CommandResult;
import com.tomopipe.process.CommandRunner;
import com.tomopipe.process.StageLaunchException;
import com.tomopipe.runtime.PipelineConfig.AcquisitionConfig;
import com.tomopipe.runtime.StorageBackend;

/**
 * Copies a session's raw data into the dataset directory before normalization. Files already
 * present are never overwritten, so an interrupted import can simply be repeated.
 */
public class RawDataImporter {
    private static final Logger log = LoggerFactory.getLogger(RawDataImporter.class);

    public static final String STAGE = "raw-data-import";

    private final CommandRunner runner;

    public RawDataImporter(CommandRunner runner) {
        this.runner = runner;
    }

    public void importInto(AcquisitionConfig acquisition, Path datasetDir) throws StageLaunchException, InterruptedException {
        List<String> command = command(acquisition, datasetDir);
        try {
            Files.createDirectories(datasetDir);
        } catch (IOException e) {
            throw new StageLaunchException(STAGE, "unable to create " + datasetDir + ": " + e.getMessage(), e);
        }
        log.info("import.start backend={} source={} target={}", acquisition.getImportBackend(), command.get(command.size() - 2), datasetDir);
        CommandResult result = runner.run(datasetDir, command);
        if (result.interrupted()) {
            throw new InterruptedException("raw data import interrupted");
        }
        if (!result.isSuccess()) {
            throw new StageLaunchException(STAGE, command.get(0) + " failed: " + result.describe());
        }
        log.info("import.done target={}", datasetDir);
    }

    static List<String> command(AcquisitionConfig acquisition, Path datasetDir) {
        String target = datasetDir.toString();
        if (acquisition.getImportBackend() == StorageBackend.PIPE_STORAGE) {
            return List.of("pipe", "storage", "cp", "-r", "--force", "--skip-existing", acquisition.getRawDataUri(), target);
        }
        String source = acquisition.getRawDataSource();
        return List.of("rsync", "--progress", "--ignore-existing", "-avr", source.endsWith("/") ? source : source + "/", target);
    }
}

package com.tomopipe.runtime;

import java.util.ArrayList;
import java.util.List;

public class PipelineConfigValidator {

    public void validate(PipelineConfig config) throws ConfigurationException {
        List<String> errors = collectErrors(config);
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid configuration: " + String.join("; ", errors));
        }
    }

    public List<String> collectErrors(PipelineConfig config) {
        List<String> errors = new ArrayList<>();
        PipelineConfig.AcquisitionConfig acquisition = config.getAcquisition();
        PipelineConfig.ReconstructionConfig reconstruction = config.getReconstruction();
        PipelineConfig.DenoisingConfig denoising = config.getDenoising();
        PipelineConfig.TransferConfig transfer = config.getTransfer();

        if (acquisition.getSoftware() == null) {
            errors.add("acquisition.software is required");
        }
        if (isBlank(acquisition.getDatasetDir())) {
            errors.add("acquisition.datasetDir is required");
        }
        if (isBlank(acquisition.getFramesName())) {
            errors.add("acquisition.framesName must not be blank");
        }
        if (isBlank(acquisition.getDuplicateMarker())) {
            errors.add("acquisition.duplicateMarker must not be blank");
        }
        if (acquisition.getPixelSize() != null && acquisition.getPixelSize() <= 0) {
            errors.add("acquisition.pixelSize must be > 0");
        }
        if (acquisition.getExposure() != null && acquisition.getExposure() <= 0) {
            errors.add("acquisition.exposure must be > 0");
        }
        if (acquisition.isImportRawData() && isBlank(acquisition.getRawDataSource())) {
            errors.add("acquisition.rawDataSource is required when importRawData is set");
        }
        if (acquisition.isImportRawData() && acquisition.getImportBackend() == StorageBackend.PIPE_STORAGE
                && isBlank(acquisition.getRawDataUri())) {
            errors.add("acquisition.rawDataUri is required when importing with PIPE_STORAGE");
        }

        if (config.getMotionCorrection().getBinning() < 1) {
            errors.add("motionCorrection.binning must be >= 1");
        }
        if (config.getMotionCorrection().getGpu() < 0) {
            errors.add("motionCorrection.gpu must be >= 0");
        }
        if (config.getMotionCorrection().getSettleMs() < 0) {
            errors.add("motionCorrection.settleMs must be >= 0");
        }

        if (reconstruction.getTrackingMethod() == null) {
            errors.add("reconstruction.trackingMethod is required");
        }
        if (reconstruction.getMethod() == null) {
            errors.add("reconstruction.method is required");
        }
        if (reconstruction.getReorientation() == null) {
            errors.add("reconstruction.reorientation is required");
        }
        if (reconstruction.getCpus() < 1) {
            errors.add("reconstruction.cpus must be >= 1");
        }
        if (reconstruction.getGpus() < 0) {
            errors.add("reconstruction.gpus must be >= 0");
        }
        if (reconstruction.getPrealignBin() < 1 || reconstruction.getFinalBin() < 1) {
            errors.add("reconstruction bin factors must be >= 1");
        }
        if (reconstruction.getPatchOverlapX() < 0 || reconstruction.getPatchOverlapX() >= 1
                || reconstruction.getPatchOverlapY() < 0 || reconstruction.getPatchOverlapY() >= 1) {
            errors.add("reconstruction patch overlaps must be in [0, 1)");
        }
        if (reconstruction.getDefocusLow() >= reconstruction.getDefocusHigh()) {
            errors.add("reconstruction.defocusLow must be below defocusHigh");
        }
        if (reconstruction.effectiveThicknessUnbinned() <= 0) {
            errors.add("reconstruction thickness must be > 0");
        }

        if (denoising.isEnabled()) {
            if (denoising.getGate() == null) {
                errors.add("denoising.gate is required");
            }
            if (isBlank(denoising.getProcessPattern())) {
                errors.add("denoising.processPattern must not be blank");
            }
            if (denoising.getWarmupThreshold() < 1) {
                errors.add("denoising.warmupThreshold must be >= 1");
            }
            if (denoising.getDrainedThreshold() < 0 || denoising.getDrainedThreshold() >= denoising.getWarmupThreshold()) {
                errors.add("denoising.drainedThreshold must be >= 0 and below warmupThreshold");
            }
            if (denoising.getDrainConfirmations() < 1) {
                errors.add("denoising.drainConfirmations must be >= 1");
            }
            if (denoising.getPollIntervalMs() <= 0) {
                errors.add("denoising.pollIntervalMs must be > 0");
            }
            PipelineConfig.DeepDeWedgeConfig deepDeWedge = denoising.getDeepDeWedge();
            if (deepDeWedge.isEnabled()) {
                if (isBlank(deepDeWedge.getExecutable()) || isBlank(deepDeWedge.getProjectDir())) {
                    errors.add("denoising.deepDeWedge.executable and projectDir must not be blank");
                }
                if (deepDeWedge.getTrainingSamples() < 1) {
                    errors.add("denoising.deepDeWedge.trainingSamples must be >= 1");
                }
                if (deepDeWedge.getCheckpoint() == null) {
                    errors.add("denoising.deepDeWedge.checkpoint is required");
                }
            }
        }

        if (transfer.isEnabled()) {
            if (isBlank(transfer.getOperator())) {
                errors.add("transfer.operator is required when transfer is enabled");
            }
            if (isBlank(transfer.getArchiveRoot())) {
                errors.add("transfer.archiveRoot is required when transfer is enabled");
            }
            if (transfer.getBackend() == null) {
                errors.add("transfer.backend is required");
            } else if (transfer.getBackend() == StorageBackend.PIPE_STORAGE && isBlank(transfer.getStorageUri())) {
                errors.add("transfer.storageUri is required for the PIPE_STORAGE backend");
            }
            if (transfer.getMaxRetries() < 0 || transfer.getRetryBackoffMs() < 0) {
                errors.add("transfer retry settings must be >= 0");
            }
        }

        if (config.getSupervision().getPollIntervalMs() <= 0) {
            errors.add("supervision.pollIntervalMs must be > 0");
        }
        return errors;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

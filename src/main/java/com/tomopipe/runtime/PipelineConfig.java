package com.tomopipe.runtime;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class PipelineConfig {
    private LayoutConfig layout = new LayoutConfig();
    private AcquisitionConfig acquisition = new AcquisitionConfig();
    private MotionCorrectionConfig motionCorrection = new MotionCorrectionConfig();
    private ReconstructionConfig reconstruction = new ReconstructionConfig();
    private DenoisingConfig denoising = new DenoisingConfig();
    private TransferConfig transfer = new TransferConfig();
    private SupervisionConfig supervision = new SupervisionConfig();

    public LayoutConfig getLayout() {
        return layout;
    }

    public void setLayout(LayoutConfig layout) {
        this.layout = layout == null ? new LayoutConfig() : layout;
    }

    public AcquisitionConfig getAcquisition() {
        return acquisition;
    }

    public void setAcquisition(AcquisitionConfig acquisition) {
        this.acquisition = acquisition == null ? new AcquisitionConfig() : acquisition;
    }

    public MotionCorrectionConfig getMotionCorrection() {
        return motionCorrection;
    }

    public void setMotionCorrection(MotionCorrectionConfig motionCorrection) {
        this.motionCorrection = motionCorrection == null ? new MotionCorrectionConfig() : motionCorrection;
    }

    public ReconstructionConfig getReconstruction() {
        return reconstruction;
    }

    public void setReconstruction(ReconstructionConfig reconstruction) {
        this.reconstruction = reconstruction == null ? new ReconstructionConfig() : reconstruction;
    }

    public DenoisingConfig getDenoising() {
        return denoising;
    }

    public void setDenoising(DenoisingConfig denoising) {
        this.denoising = denoising == null ? new DenoisingConfig() : denoising;
    }

    public TransferConfig getTransfer() {
        return transfer;
    }

    public void setTransfer(TransferConfig transfer) {
        this.transfer = transfer == null ? new TransferConfig() : transfer;
    }

    public SupervisionConfig getSupervision() {
        return supervision;
    }

    public void setSupervision(SupervisionConfig supervision) {
        this.supervision = supervision == null ? new SupervisionConfig() : supervision;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LayoutConfig {
        private String projectDir = ".";
        private String alignedDir = "Aligned";
        private String reconstructedDir = "Reconstructed";
        private String comsDir = "coms";
        private String stateDir = ".tomopipe";

        public String getProjectDir() {
            return projectDir;
        }

        public void setProjectDir(String projectDir) {
            this.projectDir = projectDir;
        }

        public String getAlignedDir() {
            return alignedDir;
        }

        public void setAlignedDir(String alignedDir) {
            this.alignedDir = alignedDir;
        }

        public String getReconstructedDir() {
            return reconstructedDir;
        }

        public void setReconstructedDir(String reconstructedDir) {
            this.reconstructedDir = reconstructedDir;
        }

        public String getComsDir() {
            return comsDir;
        }

        public void setComsDir(String comsDir) {
            this.comsDir = comsDir;
        }

        public String getStateDir() {
            return stateDir;
        }

        public void setStateDir(String stateDir) {
            this.stateDir = stateDir;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class AcquisitionConfig {
        private AcquisitionSoftware software = AcquisitionSoftware.SERIALEM;
        private String datasetDir;
        private Double tiltAxis;
        private Double pixelSize;
        private Double exposure;
        private String framesName = "Fractions";
        private String duplicateMarker = "override";
        private String frameExtension = "mrc";
        private String gainPath;
        private boolean readMdoc = true;
        private boolean importRawData = false;
        private String rawDataSource;
        private String rawDataUri;
        private StorageBackend importBackend = StorageBackend.LOCAL;

        public AcquisitionSoftware getSoftware() {
            return software;
        }

        public void setSoftware(AcquisitionSoftware software) {
            this.software = software;
        }

        public String getDatasetDir() {
            return datasetDir;
        }

        public void setDatasetDir(String datasetDir) {
            this.datasetDir = datasetDir;
        }

        public Double getTiltAxis() {
            return tiltAxis;
        }

        public void setTiltAxis(Double tiltAxis) {
            this.tiltAxis = tiltAxis;
        }

        public Double getPixelSize() {
            return pixelSize;
        }

        public void setPixelSize(Double pixelSize) {
            this.pixelSize = pixelSize;
        }

        public Double getExposure() {
            return exposure;
        }

        public void setExposure(Double exposure) {
            this.exposure = exposure;
        }

        public String getFramesName() {
            return framesName;
        }

        public void setFramesName(String framesName) {
            this.framesName = framesName;
        }

        public String getDuplicateMarker() {
            return duplicateMarker;
        }

        public void setDuplicateMarker(String duplicateMarker) {
            this.duplicateMarker = duplicateMarker;
        }

        public String getFrameExtension() {
            return frameExtension;
        }

        public void setFrameExtension(String frameExtension) {
            this.frameExtension = frameExtension;
        }

        public String getGainPath() {
            return gainPath;
        }

        public void setGainPath(String gainPath) {
            this.gainPath = gainPath;
        }

        public boolean isReadMdoc() {
            return readMdoc;
        }

        public void setReadMdoc(boolean readMdoc) {
            this.readMdoc = readMdoc;
        }

        public boolean isImportRawData() {
            return importRawData;
        }

        public void setImportRawData(boolean importRawData) {
            this.importRawData = importRawData;
        }

        public String getRawDataSource() {
            return rawDataSource;
        }

        public void setRawDataSource(String rawDataSource) {
            this.rawDataSource = rawDataSource;
        }

        public String getRawDataUri() {
            return rawDataUri;
        }

        public void setRawDataUri(String rawDataUri) {
            this.rawDataUri = rawDataUri;
        }

        public StorageBackend getImportBackend() {
            return importBackend;
        }

        public void setImportBackend(StorageBackend importBackend) {
            this.importBackend = importBackend;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MotionCorrectionConfig {
        private boolean enabled = true;
        private boolean doseWeighting = false;
        private double dropMean = 100.0;
        private int gpu = 0;
        private int binning = 1;
        private int voltage = 200;
        private boolean thumbnails = true;
        private String executable = "alignframes";
        private long settleMs = 60000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isDoseWeighting() {
            return doseWeighting;
        }

        public void setDoseWeighting(boolean doseWeighting) {
            this.doseWeighting = doseWeighting;
        }

        public double getDropMean() {
            return dropMean;
        }

        public void setDropMean(double dropMean) {
            this.dropMean = dropMean;
        }

        public int getGpu() {
            return gpu;
        }

        public void setGpu(int gpu) {
            this.gpu = gpu;
        }

        public int getBinning() {
            return binning;
        }

        public void setBinning(int binning) {
            this.binning = binning;
        }

        public int getVoltage() {
            return voltage;
        }

        public void setVoltage(int voltage) {
            this.voltage = voltage;
        }

        public boolean isThumbnails() {
            return thumbnails;
        }

        public void setThumbnails(boolean thumbnails) {
            this.thumbnails = thumbnails;
        }

        public String getExecutable() {
            return executable;
        }

        public void setExecutable(String executable) {
            this.executable = executable;
        }

        public long getSettleMs() {
            return settleMs;
        }

        public void setSettleMs(long settleMs) {
            this.settleMs = settleMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ReconstructionConfig {
        private String executable = "batchruntomo";
        private String systemTemplate = "/usr/local/IMOD/SystemTemplate/cryoSample.adoc";
        private int cpus = 4;
        private int gpus = 1;
        private boolean removeXrays = true;
        private int prealignBin = 4;
        private TrackingMethod trackingMethod = TrackingMethod.PATCH;
        private double goldSize = 0.0;
        private int patchSizeX = 200;
        private int patchSizeY = 200;
        private double patchOverlapX = 0.4;
        private double patchOverlapY = 0.4;
        private int numBeads = 25;
        private boolean useSobel = true;
        private double sobelSigma = 1.5;
        private int finalBin = 4;
        private boolean ctfCorrection = true;
        private boolean doseWeighting = true;
        private double defocusLow = 1000.0;
        private double defocusHigh = 10000.0;
        private int autofitRange = 12;
        private int autofitStep = 1;
        private boolean tuneFittingSampling = true;
        private int voltage = 200;
        private double cs = 2.7;
        private boolean bidirectional = false;
        private ReconstructionMethod method = ReconstructionMethod.SIRT_LIKE;
        private int fakeSirtIterations = 10;
        private int sirtIterations = 10;
        private int thicknessUnbinned = 1200;
        private Integer thicknessBinned;
        private boolean trimvol = true;
        private Reorientation reorientation = Reorientation.ROTATE_X;

        public String getExecutable() {
            return executable;
        }

        public void setExecutable(String executable) {
            this.executable = executable;
        }

        public String getSystemTemplate() {
            return systemTemplate;
        }

        public void setSystemTemplate(String systemTemplate) {
            this.systemTemplate = systemTemplate;
        }

        public int getCpus() {
            return cpus;
        }

        public void setCpus(int cpus) {
            this.cpus = cpus;
        }

        public int getGpus() {
            return gpus;
        }

        public void setGpus(int gpus) {
            this.gpus = gpus;
        }

        public boolean isRemoveXrays() {
            return removeXrays;
        }

        public void setRemoveXrays(boolean removeXrays) {
            this.removeXrays = removeXrays;
        }

        public int getPrealignBin() {
            return prealignBin;
        }

        public void setPrealignBin(int prealignBin) {
            this.prealignBin = prealignBin;
        }

        public TrackingMethod getTrackingMethod() {
            return trackingMethod;
        }

        public void setTrackingMethod(TrackingMethod trackingMethod) {
            this.trackingMethod = trackingMethod;
        }

        public double getGoldSize() {
            return goldSize;
        }

        public void setGoldSize(double goldSize) {
            this.goldSize = goldSize;
        }

        public int getPatchSizeX() {
            return patchSizeX;
        }

        public void setPatchSizeX(int patchSizeX) {
            this.patchSizeX = patchSizeX;
        }

        public int getPatchSizeY() {
            return patchSizeY;
        }

        public void setPatchSizeY(int patchSizeY) {
            this.patchSizeY = patchSizeY;
        }

        public double getPatchOverlapX() {
            return patchOverlapX;
        }

        public void setPatchOverlapX(double patchOverlapX) {
            this.patchOverlapX = patchOverlapX;
        }

        public double getPatchOverlapY() {
            return patchOverlapY;
        }

        public void setPatchOverlapY(double patchOverlapY) {
            this.patchOverlapY = patchOverlapY;
        }

        public int getNumBeads() {
            return numBeads;
        }

        public void setNumBeads(int numBeads) {
            this.numBeads = numBeads;
        }

        public boolean isUseSobel() {
            return useSobel;
        }

        public void setUseSobel(boolean useSobel) {
            this.useSobel = useSobel;
        }

        public double getSobelSigma() {
            return sobelSigma;
        }

        public void setSobelSigma(double sobelSigma) {
            this.sobelSigma = sobelSigma;
        }

        public int getFinalBin() {
            return finalBin;
        }

        public void setFinalBin(int finalBin) {
            this.finalBin = finalBin;
        }

        public boolean isCtfCorrection() {
            return ctfCorrection;
        }

        public void setCtfCorrection(boolean ctfCorrection) {
            this.ctfCorrection = ctfCorrection;
        }

        public boolean isDoseWeighting() {
            return doseWeighting;
        }

        public void setDoseWeighting(boolean doseWeighting) {
            this.doseWeighting = doseWeighting;
        }

        public double getDefocusLow() {
            return defocusLow;
        }

        public void setDefocusLow(double defocusLow) {
            this.defocusLow = defocusLow;
        }

        public double getDefocusHigh() {
            return defocusHigh;
        }

        public void setDefocusHigh(double defocusHigh) {
            this.defocusHigh = defocusHigh;
        }

        public int getAutofitRange() {
            return autofitRange;
        }

        public void setAutofitRange(int autofitRange) {
            this.autofitRange = autofitRange;
        }

        public int getAutofitStep() {
            return autofitStep;
        }

        public void setAutofitStep(int autofitStep) {
            this.autofitStep = autofitStep;
        }

        public boolean isTuneFittingSampling() {
            return tuneFittingSampling;
        }

        public void setTuneFittingSampling(boolean tuneFittingSampling) {
            this.tuneFittingSampling = tuneFittingSampling;
        }

        public int getVoltage() {
            return voltage;
        }

        public void setVoltage(int voltage) {
            this.voltage = voltage;
        }

        public double getCs() {
            return cs;
        }

        public void setCs(double cs) {
            this.cs = cs;
        }

        public boolean isBidirectional() {
            return bidirectional;
        }

        public void setBidirectional(boolean bidirectional) {
            this.bidirectional = bidirectional;
        }

        public ReconstructionMethod getMethod() {
            return method;
        }

        public void setMethod(ReconstructionMethod method) {
            this.method = method;
        }

        public int getFakeSirtIterations() {
            return fakeSirtIterations;
        }

        public void setFakeSirtIterations(int fakeSirtIterations) {
            this.fakeSirtIterations = fakeSirtIterations;
        }

        public int getSirtIterations() {
            return sirtIterations;
        }

        public void setSirtIterations(int sirtIterations) {
            this.sirtIterations = sirtIterations;
        }

        public int getThicknessUnbinned() {
            return thicknessUnbinned;
        }

        public void setThicknessUnbinned(int thicknessUnbinned) {
            this.thicknessUnbinned = thicknessUnbinned;
        }

        public Integer getThicknessBinned() {
            return thicknessBinned;
        }

        public void setThicknessBinned(Integer thicknessBinned) {
            this.thicknessBinned = thicknessBinned;
        }

        public boolean isTrimvol() {
            return trimvol;
        }

        public void setTrimvol(boolean trimvol) {
            this.trimvol = trimvol;
        }

        public Reorientation getReorientation() {
            return reorientation;
        }

        public void setReorientation(Reorientation reorientation) {
            this.reorientation = reorientation;
        }

        public int effectiveThicknessUnbinned() {
            return thicknessBinned != null ? thicknessBinned * finalBin : thicknessUnbinned;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DenoisingConfig {
        private boolean enabled = false;
        private GateStrategy gate = GateStrategy.PROCESS_SAMPLING;
        private String processPattern = "batchruntomo";
        private int warmupThreshold = 1;
        private int drainedThreshold = 0;
        private int drainConfirmations = 2;
        private long pollIntervalMs = 30000;
        private long warmupTimeoutMs = 0;
        private long drainTimeoutMs = 0;
        private long quietPeriodMs = 60000;
        private int binning = 6;
        private int gpu = 0;
        private String submitExecutable = "subm";
        private DeepDeWedgeConfig deepDeWedge = new DeepDeWedgeConfig();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public GateStrategy getGate() {
            return gate;
        }

        public void setGate(GateStrategy gate) {
            this.gate = gate;
        }

        public String getProcessPattern() {
            return processPattern;
        }

        public void setProcessPattern(String processPattern) {
            this.processPattern = processPattern;
        }

        public int getWarmupThreshold() {
            return warmupThreshold;
        }

        public void setWarmupThreshold(int warmupThreshold) {
            this.warmupThreshold = warmupThreshold;
        }

        public int getDrainedThreshold() {
            return drainedThreshold;
        }

        public void setDrainedThreshold(int drainedThreshold) {
            this.drainedThreshold = drainedThreshold;
        }

        public int getDrainConfirmations() {
            return drainConfirmations;
        }

        public void setDrainConfirmations(int drainConfirmations) {
            this.drainConfirmations = drainConfirmations;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getWarmupTimeoutMs() {
            return warmupTimeoutMs;
        }

        public void setWarmupTimeoutMs(long warmupTimeoutMs) {
            this.warmupTimeoutMs = warmupTimeoutMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public long getQuietPeriodMs() {
            return quietPeriodMs;
        }

        public void setQuietPeriodMs(long quietPeriodMs) {
            this.quietPeriodMs = quietPeriodMs;
        }

        public int getBinning() {
            return binning;
        }

        public void setBinning(int binning) {
            this.binning = binning;
        }

        public int getGpu() {
            return gpu;
        }

        public void setGpu(int gpu) {
            this.gpu = gpu;
        }

        public String getSubmitExecutable() {
            return submitExecutable;
        }

        public void setSubmitExecutable(String submitExecutable) {
            this.submitExecutable = submitExecutable;
        }

        public DeepDeWedgeConfig getDeepDeWedge() {
            return deepDeWedge;
        }

        public void setDeepDeWedge(DeepDeWedgeConfig deepDeWedge) {
            this.deepDeWedge = deepDeWedge == null ? new DeepDeWedgeConfig() : deepDeWedge;
        }
    }

    /**
     * Hand-off of the prepared half sets to DeepDeWedge: fit a model on a sample of them, then refine
     * every tomogram. {@code projectDir} is resolved against the layout's project directory.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DeepDeWedgeConfig {
        private boolean enabled = false;
        private String executable = "ddw";
        private String projectDir = "DDW";
        private int trainingSamples = 5;
        private long seed = 42;
        private int subtomoSize = 96;
        private int mwAngle = 60;
        private int numWorkers = 4;
        private int gpu = 0;
        private int numEpochs = 1000;
        private CheckpointSelection checkpoint = CheckpointSelection.VAL_LOSS;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getExecutable() {
            return executable;
        }

        public void setExecutable(String executable) {
            this.executable = executable;
        }

        public String getProjectDir() {
            return projectDir;
        }

        public void setProjectDir(String projectDir) {
            this.projectDir = projectDir;
        }

        public int getTrainingSamples() {
            return trainingSamples;
        }

        public void setTrainingSamples(int trainingSamples) {
            this.trainingSamples = trainingSamples;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }

        public int getSubtomoSize() {
            return subtomoSize;
        }

        public void setSubtomoSize(int subtomoSize) {
            this.subtomoSize = subtomoSize;
        }

        public int getMwAngle() {
            return mwAngle;
        }

        public void setMwAngle(int mwAngle) {
            this.mwAngle = mwAngle;
        }

        public int getNumWorkers() {
            return numWorkers;
        }

        public void setNumWorkers(int numWorkers) {
            this.numWorkers = numWorkers;
        }

        public int getGpu() {
            return gpu;
        }

        public void setGpu(int gpu) {
            this.gpu = gpu;
        }

        public int getNumEpochs() {
            return numEpochs;
        }

        public void setNumEpochs(int numEpochs) {
            this.numEpochs = numEpochs;
        }

        public CheckpointSelection getCheckpoint() {
            return checkpoint;
        }

        public void setCheckpoint(CheckpointSelection checkpoint) {
            this.checkpoint = checkpoint;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TransferConfig {
        private boolean enabled = true;
        private String operator;
        private String archiveRoot;
        private String storageUri;
        private StorageBackend backend = StorageBackend.LOCAL;
        private int maxRetries = 3;
        private long retryBackoffMs = 5000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getOperator() {
            return operator;
        }

        public void setOperator(String operator) {
            this.operator = operator;
        }

        public String getArchiveRoot() {
            return archiveRoot;
        }

        public void setArchiveRoot(String archiveRoot) {
            this.archiveRoot = archiveRoot;
        }

        public String getStorageUri() {
            return storageUri;
        }

        public void setStorageUri(String storageUri) {
            this.storageUri = storageUri;
        }

        public StorageBackend getBackend() {
            return backend;
        }

        public void setBackend(StorageBackend backend) {
            this.backend = backend;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SupervisionConfig {
        private long pollIntervalMs = 10000;
        private long workerTimeoutMs = 0;
        private List<String> stalePatterns = List.of("alignframes", "batchruntomo", "framewatcher", "serieswatcher");
        private boolean checkExecutables = true;

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public long getWorkerTimeoutMs() {
            return workerTimeoutMs;
        }

        public void setWorkerTimeoutMs(long workerTimeoutMs) {
            this.workerTimeoutMs = workerTimeoutMs;
        }

        public List<String> getStalePatterns() {
            return stalePatterns;
        }

        public void setStalePatterns(List<String> stalePatterns) {
            this.stalePatterns = stalePatterns == null ? List.of() : stalePatterns;
        }

        public boolean isCheckExecutables() {
            return checkExecutables;
        }

        public void setCheckExecutables(boolean checkExecutables) {
            this.checkExecutables = checkExecutables;
        }
    }
}

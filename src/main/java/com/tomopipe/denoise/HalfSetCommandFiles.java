package com.tomopipe.denoise;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * IMOD command files for rebuilding a tomogram from alternate views: {@code newst.com} when the
 * aligned stack has to be regenerated, {@code tilt_evens.com} and {@code tilt_odds.com} always.
 */
public final class HalfSetCommandFiles {
    public static final String NEWSTACK_COM = "newst.com";
    public static final String TILT_EVENS_COM = "tilt_evens.com";
    public static final String TILT_ODDS_COM = "tilt_odds.com";
    private static final String SAVEWORK = "$if (-e ./savework) ./savework";

    private HalfSetCommandFiles() {
    }

    public enum Half {
        EVENS(0, "evens"),
        ODDS(1, "odds");

        private final int offset;
        private final String suffix;

        Half(int offset, String suffix) {
            this.offset = offset;
            this.suffix = suffix;
        }

        public String suffix() {
            return suffix;
        }

        public String commandFile() {
            return this == EVENS ? TILT_EVENS_COM : TILT_ODDS_COM;
        }

        public String fullReconstruction(String series) {
            return series + "_full_rec_" + suffix + ".mrc";
        }

        public String reconstruction(String series) {
            return series + "_rec_" + suffix + ".mrc";
        }

        /**
         * 1-based view numbers of this half: views 1, 3, 5... for evens (every other view starting at
         * the first), 2, 4, 6... for odds.
         */
        public List<Integer> views(int viewCount) {
            return IntStream.range(0, viewCount)
                    .filter(index -> index % 2 == offset)
                    .mapToObj(index -> index + 1)
                    .toList();
        }

        public String includeLine(int viewCount) {
            return "INCLUDE " + views(viewCount).stream().map(String::valueOf).collect(Collectors.joining(","));
        }
    }

    public static String newstack(String series, int binning) {
        return String.join("\n",
                "$setenv IMOD_OUTPUT_FORMAT MRC",
                "$newstack -StandardInput",
                "AntialiasFilter\t4",
                "InputFile\t" + series + ".mrc",
                "OutputFile\t" + series + "_ali.mrc",
                "TransformFile\t" + series + ".xf",
                "LinearInterpolation\t0",
                "BinByFactor\t" + binning,
                "TaperAtFill\t1,1",
                "AdjustOrigin",
                "OffsetsInXandY\t0,0",
                "ImagesAreBinned\t1",
                SAVEWORK) + "\n";
    }

    /**
     * Tilt command for one half, derived from the unit's own {@code tilt.com} so reconstruction
     * settings match the full tomogram. View selection entries of the original are dropped.
     */
    public static String tiltFromExisting(List<String> tiltCom, String series, Half half, int imageBinned, int gpu, int viewCount) {
        List<String> lines = new ArrayList<>();
        for (String line : tiltCom) {
            String key = firstToken(line);
            switch (key) {
                case "InputProjections" -> lines.add("InputProjections " + series + "_ali.mrc");
                case "OutputFile" -> lines.add("OutputFile\t" + half.fullReconstruction(series));
                case "IMAGEBINNED" -> lines.add("IMAGEBINNED\t" + imageBinned);
                case "TILTFILE" -> lines.add("TILTFILE " + series + ".tlt");
                case "XTILTFILE" -> lines.add("XTILTFILE " + series + ".xtilt");
                case "UseGPU", "useGPU" -> lines.add("UseGPU\t" + gpu);
                case "INCLUDE", "EXCLUDE", "EXCLUDELIST", "EXCLUDELIST2" -> {
                }
                default -> lines.add(line);
            }
        }
        int insertAt = lines.size();
        while (insertAt > 0 && (lines.get(insertAt - 1).startsWith("$") || lines.get(insertAt - 1).isBlank())) {
            insertAt--;
        }
        lines.add(insertAt, half.includeLine(viewCount));
        return String.join("\n", lines) + "\n";
    }

    /**
     * Tilt command for one half when the unit has no {@code tilt.com}; sizes come from the MRC headers.
     */
    public static String freshTilt(String series, Half half, int imageBinned, int gpu, MrcHeader stack, int thicknessUnbinned) {
        return String.join("\n",
                "$setenv IMOD_OUTPUT_FORMAT MRC",
                "$tilt -StandardInput",
                "FakeSIRTiterations\t10",
                "InputProjections " + series + "_ali.mrc",
                "OutputFile\t" + half.fullReconstruction(series),
                "IMAGEBINNED\t" + imageBinned,
                "TILTFILE " + series + ".tlt",
                "XTILTFILE " + series + ".xtilt",
                "UseGPU\t" + gpu,
                "THICKNESS\t" + thicknessUnbinned,
                "RADIAL .35 .035",
                "FalloffIsTrueSigma 1",
                "SCALE 0 0.00144",
                "PERPENDICULAR",
                "MODE 1",
                "FULLIMAGE\t " + stack.nx() + " " + stack.ny(),
                "SUBSETSTART\t0 0",
                "AdjustOrigin 1",
                half.includeLine(stack.nz()),
                SAVEWORK) + "\n";
    }

    private static String firstToken(String line) {
        String stripped = line.strip();
        int end = 0;
        while (end < stripped.length() && !Character.isWhitespace(stripped.charAt(end))) {
            end++;
        }
        return stripped.substring(0, end);
    }
}

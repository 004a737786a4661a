package com.brewuv.runner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Instrument files found under an input directory, grouped by brewer id.
 * UV and B files are looked up under {@code uvdata}, UVR, ARF and parameter files under {@code instr}.
 */
public final class FileIndex {
    private static final Logger log = LogManager.getLogger(FileIndex.class);

    private final Map<String, InstrumentFiles> byBrewer = new TreeMap<>();

    public static final class InstrumentFiles {
        final NavigableMap<LocalDate, Path> uvFiles = new TreeMap<>();
        final Map<LocalDate, Path> bFiles = new TreeMap<>();
        final List<Path> uvrFiles = new ArrayList<>();
        final List<Path> arfFiles = new ArrayList<>();
        final Map<Integer, Path> parameterFiles = new TreeMap<>();
    }

    public static FileIndex scan(Path inputDir, String instrSubdir, String uvdataSubdir) throws IOException {
        FileIndex index = new FileIndex();
        index.scanDir(inputDir.resolve(instrSubdir), false);
        index.scanDir(inputDir.resolve(uvdataSubdir), true);
        for (InstrumentFiles files : index.byBrewer.values()) {
            files.uvrFiles.sort(null);
            files.arfFiles.sort(null);
        }
        log.info("indexed {} instruments under {}", index.byBrewer.size(), inputDir);
        return index;
    }

    private void scanDir(Path dir, boolean uvdata) throws IOException {
        if (!Files.isDirectory(dir)) {
            log.warn("input directory {} does not exist", dir);
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(dir)) {
            paths = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
        for (Path path : paths) {
            register(path, uvdata);
        }
    }

    void register(Path path, boolean uvdata) {
        String name = path.getFileName().toString();
        Matcher m;
        if (uvdata) {
            if ((m = InstrumentFileNames.UV.matcher(name)).matches()) {
                LocalDate date = InstrumentFileNames.dateOf(m);
                if (date != null) {
                    files(m.group("brewerId")).uvFiles.put(date, path);
                    return;
                }
            } else if ((m = InstrumentFileNames.B.matcher(name)).matches()) {
                LocalDate date = InstrumentFileNames.dateOf(m);
                if (date != null) {
                    files(m.group("brewerId")).bFiles.put(date, path);
                    return;
                }
            }
        } else {
            if ((m = InstrumentFileNames.UVR.matcher(name)).matches()) {
                files(m.group("brewerId")).uvrFiles.add(path);
                return;
            }
            if ((m = InstrumentFileNames.ARF.matcher(name)).matches()) {
                files(m.group("brewerId")).arfFiles.add(path);
                return;
            }
            if ((m = InstrumentFileNames.PARAMETER.matcher(name)).matches()) {
                files(m.group("brewerId")).parameterFiles.put(2000 + Integer.parseInt(m.group("year")), path);
                return;
            }
        }
        log.debug("ignoring unknown file {}", path);
    }

    private InstrumentFiles files(String brewerId) {
        return byBrewer.computeIfAbsent(brewerId, k -> new InstrumentFiles());
    }

    public List<String> brewerIds() {
        return new ArrayList<>(byBrewer.keySet());
    }

    public List<LocalDate> uvDates(String brewerId) {
        InstrumentFiles files = byBrewer.get(brewerId);
        return files == null ? List.of() : new ArrayList<>(files.uvFiles.keySet());
    }

    public Path uvFile(String brewerId, LocalDate date) {
        InstrumentFiles files = byBrewer.get(brewerId);
        return files == null ? null : files.uvFiles.get(date);
    }

    public Path bFile(String brewerId, LocalDate date) {
        InstrumentFiles files = byBrewer.get(brewerId);
        return files == null ? null : files.bFiles.get(date);
    }

    /**
     * First UVR file of the instrument in name order.
     */
    public Path calibrationFile(String brewerId) {
        InstrumentFiles files = byBrewer.get(brewerId);
        return files == null || files.uvrFiles.isEmpty() ? null : files.uvrFiles.get(0);
    }

    public Path arfFile(String brewerId) {
        InstrumentFiles files = byBrewer.get(brewerId);
        return files == null || files.arfFiles.isEmpty() ? null : files.arfFiles.get(0);
    }

    public Path parameterFile(String brewerId, int year) {
        InstrumentFiles files = byBrewer.get(brewerId);
        return files == null ? null : files.parameterFiles.get(year);
    }
}

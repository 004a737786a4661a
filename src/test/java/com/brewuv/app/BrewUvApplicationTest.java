package com.brewuv.app;

import com.brewuv.runner.JobSelection;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BrewUvApplicationTest {
    private static final Path WORKING_DIR = Path.of("/data/brewer");

    @Test
    void helpAndUsageErrorsReturnExitCodes() {
        BrewUvApplication app = new BrewUvApplication();

        assertEquals(0, app.run(new String[]{"--help"}));
        assertEquals(2, app.run(new String[]{"--no-such-option"}));
        assertEquals(2, app.run(new String[0]));
        assertEquals(2, app.run(new String[]{"--brewer", "033"}));
        assertEquals(2, app.run(new String[]{"--brewer", "033", "--from", "22/06/2019"}));
    }

    @Test
    void explicitFilesSelection() throws Exception {
        JobSelection selection = select("--uv", "uvdata/UV17319.033", "--uvr", "instr/UVR17319.033");

        assertEquals(JobSelection.Mode.FILES, selection.mode);
        assertEquals(WORKING_DIR.resolve("uvdata/UV17319.033"), selection.uvFile);
        assertEquals(WORKING_DIR.resolve("instr/UVR17319.033"), selection.uvrFile);
        assertNull(selection.bFile);
    }

    @Test
    void dateRangeDefaultsEndToStart() throws Exception {
        JobSelection selection = select("--brewer", "033", "--from", "2019-06-22");

        assertEquals(JobSelection.Mode.DATE_RANGE, selection.mode);
        assertEquals("033", selection.brewerId);
        assertEquals(LocalDate.of(2019, 6, 22), selection.to);
    }

    @Test
    void scanWithoutDirectoryUsesConfiguredInput() throws Exception {
        assertNull(select("--scan").inputDir);
        assertEquals(WORKING_DIR.resolve("archive"), select("--scan", "archive").inputDir);
    }

    @Test
    void selectionIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> select());
    }

    private static JobSelection select(String... args) throws Exception {
        CommandLine cmd = new DefaultParser().parse(BrewUvApplication.buildOptions(), args);
        return BrewUvApplication.selectionFrom(cmd, WORKING_DIR);
    }
}

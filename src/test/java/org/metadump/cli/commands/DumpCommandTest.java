package org.metadump.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.metadump.cli.CommandLineInterface;
import org.metadump.output.Section;
import org.metadump.toc.TableOfContents;
import org.metadump.toc.TocEntry;
import org.metadump.toc.TocFile;

import picocli.CommandLine;

/**
 * End-to-end tests of the dump, toc and extract commands over the sample catalog.
 */
public class DumpCommandTest {

    @TempDir
    Path tempDir;

    private static Path sampleCatalog() throws URISyntaxException {
        return Path.of(DumpCommandTest.class.getResource("/sample-catalog.json").toURI());
    }

    private static int run(StringWriter out, StringWriter err, String... args) {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute(args);
    }

    @Test
    @Tag("unit")
    void testCommandsAreRegistered() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getSubcommands()).containsKeys("dump", "extract", "toc");
    }

    @Test
    @Tag("unit")
    void testHelpOutput() {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();

        run(out, err, "dump", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("--catalog").contains("--output");
    }

    @Test
    @Tag("unit")
    void testCatalogIsRequired() {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();

        int exitCode = run(out, err, "dump");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--catalog");
    }

    @Test
    @Tag("integration")
    void testDumpThenListThenExtract() throws Exception {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();

        int exitCode = run(out, err, "dump", "--catalog", sampleCatalog().toString(), "--output", tempDir.toString());

        assertThat(exitCode).as(err.toString()).isEqualTo(0);
        assertThat(out.toString()).contains("Dumped 12 objects").contains("metadata_predata.sql");
        assertThat(tempDir.resolve("toc.json")).exists();
        assertThat(tempDir.resolve("metadata_global.sql")).exists();

        String toc = tempDir.resolve("toc.json").toString();
        StringWriter listing = new StringWriter();
        assertThat(run(listing, new StringWriter(), "toc", "--toc", toc, "--section", "PREDATA")).isEqualTo(0);
        assertThat(listing.toString())
                .contains("=== predata")
                .contains("SHELL TYPE")
                .contains("public.money_t")
                .doesNotContain("=== global");

        StringWriter extracted = new StringWriter();
        assertThat(run(extracted, new StringWriter(), "extract", "--toc", toc, "--section", "predata",
                "--schema", "public", "--name", "money_t", "--kind", "TYPE")).isEqualTo(0);
        assertThat(extracted.toString())
                .contains("CREATE TYPE public.money_t (")
                .doesNotContain("CREATE TYPE public.money_t;");

        StringWriter roles = new StringWriter();
        assertThat(run(roles, new StringWriter(), "extract", "--toc", toc, "--section", "global",
                "--name", "analyst", "--kind", "ROLE")).isEqualTo(0);
        assertThat(roles.toString()).contains("CREATE ROLE analyst;").doesNotContain("GRANT readers");
    }

    @Test
    @Tag("integration")
    void testExtractWritesExactlyTheRecordedBytes() throws Exception {
        run(new StringWriter(), new StringWriter(), "dump", "--catalog", sampleCatalog().toString(),
                "--output", tempDir.toString());
        TableOfContents toc = TocFile.read(tempDir.resolve("toc.json"));
        TocEntry entry = toc.find(Section.GLOBAL, "", "warehouse", "DATABASE").orElseThrow();
        byte[] global = Files.readAllBytes(tempDir.resolve("metadata_global.sql"));
        String recorded = new String(global, (int) entry.startOffset(), (int) entry.length(), StandardCharsets.UTF_8);

        StringWriter extracted = new StringWriter();
        int exitCode = run(extracted, new StringWriter(), "extract", "--toc", tempDir.resolve("toc.json").toString(),
                "--section", "global", "--name", "warehouse", "--kind", "DATABASE");

        assertThat(exitCode).isEqualTo(0);
        assertThat(extracted.toString()).isEqualTo(recorded).endsWith(";");
    }

    @Test
    @Tag("integration")
    void testExtractUnknownObjectFails() throws Exception {
        run(new StringWriter(), new StringWriter(), "dump", "--catalog", sampleCatalog().toString(),
                "--output", tempDir.toString());
        StringWriter err = new StringWriter();

        int exitCode = run(new StringWriter(), err, "extract", "--toc", tempDir.resolve("toc.json").toString(),
                "--section", "predata", "--schema", "public", "--name", "nope");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("no entry for public.nope");
    }

    @Test
    @Tag("unit")
    void testUnknownSectionIsRejected() {
        StringWriter err = new StringWriter();

        int exitCode = run(new StringWriter(), err, "toc", "--toc", "toc.json", "--section", "middle");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("middle");
    }

    @Test
    @Tag("unit")
    void testMissingCatalogFileFails() {
        StringWriter err = new StringWriter();

        int exitCode = run(new StringWriter(), err, "dump", "--catalog", tempDir.resolve("absent.json").toString(),
                "--output", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Error:");
    }
}

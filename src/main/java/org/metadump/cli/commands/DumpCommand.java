package org.metadump.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.metadump.catalog.CatalogSnapshot;
import org.metadump.catalog.CatalogSnapshotReader;
import org.metadump.cli.CommandLineInterface;
import org.metadump.emit.DumpResult;
import org.metadump.emit.DumpRunner;
import org.metadump.emit.DumpSettings;
import org.metadump.output.Section;
import org.metadump.render.DefaultStatementRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Writes the section files and the table of contents for a catalog snapshot.
 */
@Command(
    name = "dump",
    description = "Dump the metadata of a catalog snapshot to section files with a table of contents"
)
public class DumpCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(DumpCommand.class);

    @Option(
        names = {"--catalog"},
        required = true,
        description = "Catalog snapshot JSON file produced by the catalog query layer"
    )
    private Path catalogFile;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (default: metadump.outputDirectory)"
    )
    private Path outputDirectory;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            DumpSettings settings = DumpSettings.fromConfig(parent.getConfig().getConfig("metadump"));
            if (outputDirectory != null) {
                settings = settings.withOutputDirectory(outputDirectory);
            }

            CatalogSnapshot snapshot = new CatalogSnapshotReader().read(catalogFile);
            DumpRunner runner = new DumpRunner(settings, new DefaultStatementRenderer(snapshot.sourceVersion()));
            DumpResult result = runner.run(snapshot.records());

            out.printf("Dumped %d objects (%d statements, %d TOC entries) in %d ms%n",
                    result.objects(), result.steps(), result.tocEntries(), result.elapsed().toMillis());
            for (Section section : Section.values()) {
                out.printf("  %-9s %10d bytes  %s%n", section.tag(),
                        result.sectionBytes().getOrDefault(section, 0L), settings.destination(section));
            }
            out.printf("  %-9s %s%n", "toc", result.tocFile());
            return 0;
        } catch (Exception e) {
            log.error("Dump failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

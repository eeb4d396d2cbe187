package org.metadump.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.metadump.output.Section;
import org.metadump.toc.TableOfContents;
import org.metadump.toc.TocEntry;
import org.metadump.toc.TocFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * Lists the entries of a table of contents in emission order.
 */
@Command(
    name = "toc",
    description = "List the entries of a dump's table of contents"
)
public class TocCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TocCommand.class);

    @Option(names = {"--toc"}, required = true, description = "Table of contents file of the dump")
    private Path tocFile;

    @Option(
        names = {"--section"},
        converter = SectionConverter.class,
        description = "Only list this section (default: all)"
    )
    private Section section;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            TableOfContents toc = TocFile.read(tocFile);
            List<Section> sections = section == null ? List.of(Section.values()) : List.of(section);
            for (Section current : sections) {
                List<TocEntry> entries = toc.entries(current);
                out.printf("=== %s (%d entries, %d bytes) ===%n", current.tag(), entries.size(), toc.endOffset(current));
                for (TocEntry entry : entries) {
                    out.printf("%10d %10d  %-14s %s%n", entry.startOffset(), entry.endOffset(), entry.kind(),
                            entry.schema().isEmpty() ? entry.name() : entry.schema() + "." + entry.name());
                }
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.error("Reading table of contents failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

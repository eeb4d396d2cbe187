package org.metadump.cli.commands;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.metadump.cli.CommandLineInterface;
import org.metadump.emit.DumpSettings;
import org.metadump.output.Section;
import org.metadump.toc.SectionExtractor;
import org.metadump.toc.TableOfContents;
import org.metadump.toc.TocEntry;
import org.metadump.toc.TocFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints the statements of a single object from a finished dump, reading only its byte ranges.
 * <p>
 * Section files are looked up next to the TOC file, under the names configured in
 * {@code metadump.sections}.
 */
@Command(
    name = "extract",
    description = "Print the statements of one dumped object using the table of contents"
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Option(names = {"--toc"}, required = true, description = "Table of contents file of the dump")
    private Path tocFile;

    @Option(
        names = {"--section"},
        required = true,
        converter = SectionConverter.class,
        description = "Section to read: global, predata or postdata"
    )
    private Section section;

    @Option(names = {"--schema"}, defaultValue = "", description = "Schema of the object (empty for global objects)")
    private String schema;

    @Option(names = {"--name"}, required = true, description = "Name of the object")
    private String name;

    @Option(names = {"--kind"}, description = "Only entries with this TOC kind, e.g. 'SHELL TYPE'")
    private String kind;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            TableOfContents toc = TocFile.read(tocFile);
            Path dumpDirectory = tocFile.toAbsolutePath().getParent();
            DumpSettings settings = DumpSettings.fromConfig(parent.getConfig().getConfig("metadump"))
                    .withOutputDirectory(dumpDirectory);
            SectionExtractor extractor = new SectionExtractor(toc, settings.destinations());

            List<TocEntry> entries = toc.lookup(section, schema, name);
            if (kind != null) {
                entries = entries.stream().filter(entry -> entry.kind().equals(kind)).toList();
            }
            if (entries.isEmpty()) {
                String object = schema.isEmpty() ? name : schema + "." + name;
                err.printf("Error: no %sentry for %s in the %s section%n",
                        kind == null ? "" : kind + " ", object, section.tag());
                return 1;
            }
            for (TocEntry entry : entries) {
                out.print(extractor.extract(entry));
            }
            out.flush();
            return 0;
        } catch (Exception e) {
            log.error("Extraction failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        }
    }
}

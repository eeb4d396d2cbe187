package org.metadump.cli.commands;

import org.metadump.output.Section;

import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Accepts section tags ({@code global}, {@code predata}, {@code postdata}) in any case.
 */
public class SectionConverter implements ITypeConverter<Section> {

    @Override
    public Section convert(String value) {
        try {
            return Section.fromTag(value);
        } catch (IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage() + " (expected global, predata or postdata)");
        }
    }
}

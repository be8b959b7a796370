package spl.idstring.cli;

import picocli.CommandLine;
import spl.idstring.config.LogFormat;

/**
 * Parses the {@code --log-format} option, turning unsupported values into picocli input errors.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}

package dbview.fx.prefs.converters;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import javafx.util.StringConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converter between a {@link Path} and its string form.
 * A blank string is read as no path, rather than as the working directory.
 */
public class PathConverter extends StringConverter<Path> {

    private static final Logger logger = LoggerFactory.getLogger(PathConverter.class);

    @Override
    public String toString(Path path) {
        return path == null ? null : path.toString();
    }

    @Override
    public Path fromString(String string) {
        if (string == null || string.isBlank())
            return null;
        try {
            return Paths.get(string);
        } catch (InvalidPathException e) {
            logger.error("Could not parse path from " + string, e);
            return null;
        }
    }
}

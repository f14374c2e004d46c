package dbview.fx.prefs.converters;

import javafx.util.StringConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converter between an enum value and its name.
 * @param <T> the enum type
 */
public class EnumConverter<T extends Enum<T>> extends StringConverter<T> {

    private static final Logger logger = LoggerFactory.getLogger(EnumConverter.class);

    private final Class<T> enumType;

    public EnumConverter(Class<T> enumType) {
        this.enumType = enumType;
    }

    @Override
    public String toString(T object) {
        return object == null ? null : object.name();
    }

    @Override
    public T fromString(String string) {
        if (string == null)
            return null;
        try {
            return Enum.valueOf(enumType, string);
        } catch (IllegalArgumentException e) {
            logger.warn("Could not parse {} value: {}", enumType.getSimpleName(), string);
            return null;
        }
    }
}

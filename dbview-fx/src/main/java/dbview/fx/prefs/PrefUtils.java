package dbview.fx.prefs;

import java.util.function.Supplier;
import java.util.prefs.Preferences;

import javafx.beans.property.BooleanProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleBooleanProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;
import javafx.util.StringConverter;

/**
 * Create JavaFX properties whose values are written to a {@link Preferences} node whenever they change.
 * The node is requested on every write, since it may be replaced when preferences are reset.
 */
class PrefUtils {

    static BooleanProperty createPersistentBooleanProperty(Supplier<Preferences> prefs, String key, boolean defaultValue) {
        var prop = new SimpleBooleanProperty(null, key, defaultValue);
        prop.set(prefs.get().getBoolean(key, defaultValue));
        prop.addListener((observable, oldValue, newValue) -> prefs.get().putBoolean(key, newValue));
        return prop;
    }

    static StringProperty createPersistentStringProperty(Supplier<Preferences> prefs, String key, String defaultValue) {
        var prop = new SimpleStringProperty(null, key, defaultValue);
        prop.set(prefs.get().get(key, defaultValue));
        prop.addListener((observable, oldValue, newValue) -> updateStringValue(prefs.get(), key, newValue));
        return prop;
    }

    static <T> ObjectProperty<T> createPersistentObjectProperty(Supplier<Preferences> prefs, String key, T defaultValue, StringConverter<T> converter) {
        var prop = new SimpleObjectProperty<T>(null, key, defaultValue);
        prop.set(readObjectValue(prefs.get(), key, defaultValue, converter));
        prop.addListener((observable, oldValue, newValue) -> 
            updateStringValue(prefs.get(), key, newValue == null ? null : converter.toString(newValue)));
        return prop;
    }

    static <T> T readObjectValue(Preferences prefs, String key, T defaultValue, StringConverter<T> converter) {
        var stored = prefs.get(key, null);
        if (stored == null)
            return defaultValue;
        T value = converter.fromString(stored);
        return value == null ? defaultValue : value;
    }

    private static void updateStringValue(Preferences prefs, String key, String value) {
        if (value == null)
            prefs.remove(key);
        else
            prefs.put(key, value);
    }

}

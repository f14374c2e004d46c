package dbview.fx.prefs;

import java.nio.file.Path;
import java.util.Objects;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

import javafx.beans.property.BooleanProperty;
import javafx.beans.property.LongProperty;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleLongProperty;
import javafx.beans.property.StringProperty;
import javafx.util.StringConverter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.prefs.converters.EnumConverter;
import dbview.fx.prefs.converters.PathConverter;

/**
 * A utility class for managing preferences in a JavaFX application.
 * <p>
 * This class provides methods for creating properties that are backed by a {@link Preferences} object.
 * The properties can be reset to their default values by calling {@link #reset()}, and can have
 * their values reloaded from the backing store by calling {@link #reload()}.
 * <p>
 * Note that {@link #save()} should be called to ensure that any changes are saved to the
 * backing store before the host application is closed.
 */
public class PreferenceManager {

    private static final Logger logger = LoggerFactory.getLogger(PreferenceManager.class);

    private final String pathName;
    private Preferences preferences;

    private final LongProperty reloadCount = new SimpleLongProperty(0L);
    private final LongProperty resetCount = new SimpleLongProperty(0L);

    private PreferenceManager(Preferences preferences, String pathName) {
        Objects.requireNonNull(preferences, "Preferences cannot be null");
        this.preferences = preferences;
        this.pathName = pathName;
        logger.trace("Preference manager created with name: {}", preferences.name());
    }

    /**
     * Create a preference manager using the provided path name to create a user preferences node.
     * @param pathName
     * @return a new preference manager instance
     */
    public static PreferenceManager createForUserPreferences(String pathName) {
        return new PreferenceManager(Preferences.userRoot().node(pathName), pathName);
    }

    /**
     * Get the {@link Preferences} object currently backing this {@link PreferenceManager}.
     * @return
     */
    public synchronized Preferences getPreferences() {
        return preferences;
    }

    /**
     * Remove all stored values and reset every property created from this manager to its default.
     * @throws BackingStoreException
     */
    public synchronized void reset() throws BackingStoreException {
        preferences.removeNode();
        preferences.flush();
        // A removed node cannot be used again
        preferences = Preferences.userRoot().node(pathName);
        resetCount.set(resetCount.get() + 1L);
        logger.info("Preferences reset for {}", pathName);
    }

    /**
     * Request that all properties have their values reloaded from the backing store.
     */
    public synchronized void reload() {
        reloadCount.set(reloadCount.get() + 1L);
    }

    /**
     * Save the preferences to the backing store.
     * @throws BackingStoreException
     */
    public synchronized void save() throws BackingStoreException {
        preferences.flush();
    }

    /**
     * Create a boolean property that is persisted to the backing store with the specified key.
     * @param key key used to store the property value, and used for the property name
     * @param defaultValue default property value; used if the property is not found in the backing store,
     *                     or if {@link PreferenceManager#reset()} is called.
     * @return the property
     */
    public BooleanProperty createPersistentBooleanProperty(String key, boolean defaultValue) {
        var prop = PrefUtils.createPersistentBooleanProperty(this::getPreferences, key, defaultValue);
        reloadCount.addListener((observable, oldValue, newValue) -> prop.set(getPreferences().getBoolean(key, prop.get())));
        resetCount.addListener((observable, oldValue, newValue) -> prop.set(defaultValue));
        return prop;
    }

    /**
     * Create a String property that is persisted to the backing store with the specified key.
     * @param key key used to store the property value, and used for the property name
     * @param defaultValue default property value; used if the property is not found in the backing store,
     *                     or if {@link PreferenceManager#reset()} is called.
     * @return the property
     */
    public StringProperty createPersistentStringProperty(String key, String defaultValue) {
        var prop = PrefUtils.createPersistentStringProperty(this::getPreferences, key, defaultValue);
        reloadCount.addListener((observable, oldValue, newValue) -> prop.set(getPreferences().get(key, prop.get())));
        resetCount.addListener((observable, oldValue, newValue) -> prop.set(defaultValue));
        return prop;
    }

    /**
     * Create an enum property that is persisted to the backing store with the specified key.
     * @param key key used to store the property value, and used for the property name
     * @param defaultValue default property value, which must not be null
     * @param enumType the enum type, required for conversion to/from a preference string
     * @return the property
     * @param <T> the enum type
     */
    public <T extends Enum<T>> ObjectProperty<T> createPersistentEnumProperty(String key, T defaultValue, Class<T> enumType) {
        return createPersistentObjectProperty(key, defaultValue, new EnumConverter<>(enumType));
    }

    /**
     * Create a property storing a {@link Path} that is persisted to the backing store with the specified key.
     * @param key key used to store the property value, and used for the property name
     * @param defaultValue default property value; may be null
     * @return the property
     */
    public ObjectProperty<Path> createPersistentPathProperty(String key, Path defaultValue) {
        return createPersistentObjectProperty(key, defaultValue, new PathConverter());
    }

    /**
     * Create an object property that is persisted to the backing store with the specified key and converter.
     * @param key key used to store the property value, and used for the property name
     * @param defaultValue default property value; used if the property is not found in the backing store,
     *                     or if {@link PreferenceManager#reset()} is called.
     * @param converter a string converter to assist with conversion to/from a preference string
     * @return the property
     * @param <T> the property type
     */
    public <T> ObjectProperty<T> createPersistentObjectProperty(String key, T defaultValue, StringConverter<T> converter) {
        var prop = PrefUtils.createPersistentObjectProperty(this::getPreferences, key, defaultValue, converter);
        reloadCount.addListener((observable, oldValue, newValue) ->
                prop.set(PrefUtils.readObjectValue(getPreferences(), key, defaultValue, converter)));
        resetCount.addListener((observable, oldValue, newValue) -> prop.set(defaultValue));
        return prop;
    }

}

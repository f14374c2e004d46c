package dbview.fx.dialogs;

import java.io.File;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.WeakHashMap;

import javafx.beans.property.SimpleStringProperty;
import javafx.beans.property.StringProperty;
import javafx.stage.DirectoryChooser;
import javafx.stage.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.fx.utils.FXUtils;

/**
 * Helper class for prompting the user to choose directories.
 * <p>
 * The last directory chosen for each owner window is remembered, and used as the starting point
 * the next time a chooser is shown for the same owner.
 */
public class FileChoosers {

    private static final Logger logger = LoggerFactory.getLogger(FileChoosers.class);

    private static final ResourceBundle resources = ResourceBundle.getBundle("dbview.fx.localization.strings");

    private static final Map<Window, File> lastDirectoryMap = new WeakHashMap<>();

    // Static methods only
    private FileChoosers() {}

    /**
     * Show a directory chooser that prompts the user to select a single directory.
     *
     * @param title title for the directory chooser (not supported on all platforms, may be null)
     * @param initialDir initial directory to display (optional, may be null)
     * @return selected directory, or null if no directory was selected
     */
    public static File promptForDirectory(String title, File initialDir) {
        return promptForDirectory(null, title, initialDir);
    }

    /**
     * Show a directory chooser that prompts the user to select a single directory, with an optional parent window and title.
     *
     * @param owner window that owns the chooser
     * @param title title for the directory chooser (not supported on all platforms, may be null)
     * @param initialDir initial directory to display (optional, may be null); if null, the last directory
     *                   chosen for the owner is used
     * @return the selected directory, or null if the chooser was cancelled
     */
    public static File promptForDirectory(Window owner, String title, File initialDir) {
        var dir = initialDir != null && initialDir.isDirectory() ? initialDir : getInitialDirectoryForOwner(owner);
        var chooser = buildDirectoryChooser()
                .title(title == null ? resources.getString("chooseDirectory") : title)
                .initialDirectory(dir)
                .build();
        var selected = FXUtils.callOnApplicationThread(() -> chooser.showDialog(owner == null ? Dialogs.getDefaultOwner() : owner));
        if (selected == null)
            logger.debug("Directory chooser cancelled");
        else
            lastDirectoryMap.put(owner, selected);
        return selected;
    }

    private static File getInitialDirectoryForOwner(Window owner) {
        var dir = lastDirectoryMap.get(owner);
        if (dir == null && owner != null)
            dir = lastDirectoryMap.get(null);
        return dir != null && dir.isDirectory() ? dir : null;
    }

    /**
     * Create a builder to build a customized JavaFX DirectoryChooser.
     * @return
     */
    public static DirectoryChooserBuilder buildDirectoryChooser() {
        return new DirectoryChooserBuilder();
    }

    /**
     * Builder for a {@link DirectoryChooser}.
     */
    public static class DirectoryChooserBuilder {

        private StringProperty titleProperty;

        private File initialDirectory;

        /**
         * Set the chooser title. Note that this is not supported on all platforms
         * (e.g. macOS currently does not display the title).
         * @param title
         * @return
         */
        public DirectoryChooserBuilder title(String title) {
            return titleProperty(new SimpleStringProperty(title));
        }

        /**
         * Set the chooser title property, so that the title follows localization changes.
         * @param titleProperty
         * @return
         */
        public DirectoryChooserBuilder titleProperty(StringProperty titleProperty) {
            this.titleProperty = titleProperty;
            return this;
        }

        /**
         * Set the initial directory for the chooser.
         * @param dir
         * @return
         */
        public DirectoryChooserBuilder initialDirectory(File dir) {
            this.initialDirectory = dir;
            return this;
        }

        /**
         * Build the chooser using the specified options.
         * @return
         */
        public DirectoryChooser build() {
            var chooser = new DirectoryChooser();
            if (titleProperty != null)
                chooser.titleProperty().bind(titleProperty);
            if (initialDirectory != null)
                chooser.setInitialDirectory(initialDirectory);
            return chooser;
        }

    }

}

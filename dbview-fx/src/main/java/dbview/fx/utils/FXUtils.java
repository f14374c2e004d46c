package dbview.fx.utils;

import java.text.NumberFormat;
import java.text.ParsePosition;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;

import javafx.application.Platform;
import javafx.beans.binding.Bindings;
import javafx.beans.binding.DoubleBinding;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleObjectProperty;
import javafx.beans.value.ObservableValue;
import javafx.scene.Node;
import javafx.scene.control.Spinner;
import javafx.scene.control.SpinnerValueFactory;
import javafx.scene.control.TextField;
import javafx.scene.control.TextFormatter;
import javafx.stage.Window;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static helpers for working with JavaFX threads and controls.
 */
public class FXUtils {

    private static final Logger logger = LoggerFactory.getLogger(FXUtils.class);

    /**
     * Letters other than E/e, which may appear in scientific notation.
     */
    private static final Pattern INVALID_NUMBER_CHARS = Pattern.compile("[a-zA-Z&&[^Ee]]+");

    // Static methods only
    private FXUtils() {}

    /**
     * Return a result after executing a Callable on the JavaFX Application Thread, waiting if necessary.
     *
     * @param callable
     * @return the result, or null if the callable threw an exception
     */
    public static <T> T callOnApplicationThread(final Callable<T> callable) {
        if (Platform.isFxApplicationThread()) {
            try {
                return callable.call();
            } catch (Exception e) {
                logger.error("Error calling directly on Platform thread", e);
                return null;
            }
        }

        CountDownLatch latch = new CountDownLatch(1);
        ObjectProperty<T> result = new SimpleObjectProperty<>();
        Platform.runLater(() -> {
            try {
                result.setValue(callable.call());
            } catch (Exception e) {
                logger.error("Error calling on Platform thread", e);
            } finally {
                latch.countDown();
            }
        });

        try {
            latch.await();
        } catch (InterruptedException e) {
            logger.error("Interrupted while waiting result", e);
            Thread.currentThread().interrupt();
        }
        return result.getValue();
    }

    /**
     * Run on the application thread and wait until this is complete.
     * @param runnable
     */
    public static void runOnApplicationThread(final Runnable runnable) {
        callOnApplicationThread(() -> {
            runnable.run();
            return runnable;
        });
    }

    /**
     * Get the {@link Window} containing a specific {@link Node}.
     * @param node
     * @return the window, or null if the node is not part of a scene
     */
    public static Window getWindow(Node node) {
        var scene = node.getScene();
        return scene == null ? null : scene.getWindow();
    }

    /**
     * Create an editable {@link Spinner} for double values with a step size that adapts to the magnitude
     * of the current value, useful where values cover a wide range (e.g. window center and width).
     * @param minValue
     * @param maxValue
     * @param defaultValue
     * @param minStepValue
     * @param scale number of decimal places to shift the step size relative to the log10 of the value
     * @return
     */
    public static Spinner<Double> createDynamicStepSpinner(double minValue, double maxValue, double defaultValue, double minStepValue, int scale) {
        var factory = new SpinnerValueFactory.DoubleSpinnerValueFactory(minValue, maxValue, defaultValue);
        factory.amountToStepByProperty().bind(createStepBinding(factory.valueProperty(), minStepValue, scale));
        var spinner = new Spinner<>(factory);
        spinner.setEditable(true);
        restrictTextFieldInputToNumber(spinner.getEditor(), true);
        resetSpinnerNullToPrevious(spinner);
        return spinner;
    }

    /**
     * Create a binding giving a step size based upon the absolute value of the input.
     *
     * @param value current value
     * @param minStep minimum step size (should be &gt; 0)
     * @param scale number of decimal places to shift the step size relative to the log10 of the value
     * @return
     */
    public static DoubleBinding createStepBinding(ObservableValue<Double> value, double minStep, int scale) {
        return Bindings.createDoubleBinding(() -> {
            Double val = value.getValue();
            if (val == null || !Double.isFinite(val) || val == 0)
                return Math.max(1.0, minStep);
            return Math.max(Math.pow(10, Math.floor(Math.log10(Math.abs(val)) - scale)), minStep);
        }, value);
    }

    /**
     * Reset the value of a spinner to its previous value whenever it becomes null.
     * @param <T>
     * @param spinner
     */
    public static <T> void resetSpinnerNullToPrevious(Spinner<T> spinner) {
        spinner.valueProperty().addListener((v, o, n) -> {
            if (n == null)
                spinner.getValueFactory().setValue(o);
        });
    }

    /**
     * Restrict the input of a text field to characters that can form a number,
     * optionally with decimals and scientific notation.
     * <p>
     * Intermediate states while typing (e.g. a lone minus sign) are accepted, so the
     * text may still be unparseable when editing ends.
     *
     * @param textField
     * @param allowDecimals
     */
    public static void restrictTextFieldInputToNumber(TextField textField, boolean allowDecimals) {
        NumberFormat format = allowDecimals ? NumberFormat.getNumberInstance() : NumberFormat.getIntegerInstance();

        UnaryOperator<TextFormatter.Change> filter = c -> {
            if (!c.isContentChange())
                return c;
            String text = c.getControlText().toUpperCase();
            String newText = c.getControlNewText().toUpperCase();

            if (INVALID_NUMBER_CHARS.matcher(newText).find())
                return null;

            // Minus sign at the start, or after an exponent
            if ((newText.length() == 1 || text.endsWith("E")) && newText.endsWith("-"))
                return c;

            // A single exponent after at least one digit
            boolean hasDigitBefore = newText.length() > 1 && !newText.startsWith("-") || newText.length() > 2;
            if (allowDecimals && hasDigitBefore && !text.contains("E") && newText.contains("E"))
                return c;

            if (newText.isEmpty())
                return c;

            ParsePosition pos = new ParsePosition(0);
            format.parse(newText, pos);
            return pos.getIndex() < newText.length() ? null : c;
        };
        textField.setTextFormatter(new TextFormatter<>(filter));
    }

}

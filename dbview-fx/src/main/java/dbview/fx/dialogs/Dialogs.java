package dbview.fx.dialogs;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.controlsfx.control.Notifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javafx.application.Platform;
import javafx.scene.Node;
import javafx.scene.control.Alert;
import javafx.scene.control.Alert.AlertType;
import javafx.scene.control.ButtonType;
import javafx.scene.control.Dialog;
import javafx.scene.control.DialogPane;
import javafx.scene.control.Label;
import javafx.stage.Modality;
import javafx.stage.Stage;
import javafx.stage.Window;
import dbview.fx.utils.FXUtils;

/**
 * Collection of static methods to help with showing information to a user, 
 * as well as requesting some basic input.
 * <p>
 * In general, 'showABCMessage' produces a dialog box that requires input from the user.
 * By contrast, 'showABCNotification' shows a message that will disappear without user input.
 * Every message is also logged, so that nothing is lost when no window is showing.
 */
public class Dialogs {
	
	private static final Logger logger = LoggerFactory.getLogger(Dialogs.class);

	private static Window primaryWindow;
	
	/**
	 * Set the primary window, which will be used as the owner of dialogs
	 * if no other window takes precedence (e.g. because it is modal or in focus).
	 * @param window
	 * @see #getPrimaryWindow()
	 */
	public static void setPrimaryWindow(Window window) {
		primaryWindow = window;
	}

	/**
	 * Get the primary window.
	 * @return
	 * @see #setPrimaryWindow(Window)
	 */
	public static Window getPrimaryWindow() {
		return primaryWindow;
	}
	
	/**
	 * Show a message dialog (OK button only), blocking until it is dismissed.
	 * @param title
	 * @param message
	 * @return true if OK was pressed
	 */
	public static boolean showMessageDialog(String title, String message) {
		logger.info("{}: {}", title, message);
		if (isHeadless())
			return false;
		return new Builder()
				.buttons(ButtonType.OK)
				.title(title)
				.content(createContentLabel(message))
				.resizable()
				.showAndWait()
				.orElse(ButtonType.CANCEL) == ButtonType.OK;
	}
	
	/**
	 * Show a Yes/No dialog.
	 * @param title
	 * @param text
	 * @return true if Yes was pressed
	 */
	public static boolean showYesNoDialog(String title, String text) {
		return new Builder()
			.alertType(AlertType.NONE)
			.buttons(ButtonType.YES, ButtonType.NO)
			.title(title)
			.content(createContentLabel(text))
			.showAndWait()
			.orElse(ButtonType.NO) == ButtonType.YES;
	}
	
	/**
	 * Create a content label, patterned on the default for {@link DialogPane} but 
	 * with the min size set to the preferred size to avoid ellipsis with long text.
	 * @param text
	 * @return
	 */
	private static Label createContentLabel(String text) {
		var label = new Label(text);
		label.setMaxWidth(Double.MAX_VALUE);
		label.setMaxHeight(Double.MAX_VALUE);
		label.setMinSize(Label.USE_PREF_SIZE, Label.USE_PREF_SIZE);
		label.setWrapText(true);
		label.setPrefWidth(360);
		return label;
	}
	
	/**
	 * Show an error message, displaying the localized message of a {@link Throwable}.
	 * @param title
	 * @param e
	 */
	public static void showErrorMessage(final String title, final Throwable e) {
		logger.error(title, e);
		if (!isHeadless())
			showErrorMessageDialog(title, getMessage(e));
	}

	/**
	 * Show an error message.
	 * @param title
	 * @param message
	 */
	public static void showErrorMessage(final String title, final String message) {
		logger.error("{}: {}", title, message);
		if (!isHeadless())
			showErrorMessageDialog(title, message);
	}
	
	private static void showErrorMessageDialog(final String title, final String message) {
		new Builder()
			.alertType(AlertType.ERROR)
			.title(title)
			.content(createContentLabel(message))
			.show();
	}
	
	/**
	 * Show an error notification, displaying the localized message of a {@link Throwable}.
	 * @param title
	 * @param e
	 */
	public static void showErrorNotification(final String title, final Throwable e) {
		String message = e.getLocalizedMessage();
		if (message != null && !message.isBlank() && !message.equals(title))
			logger.error(title + ": " + message, e);
		else
			logger.error(title, e);
		if (!isHeadless())
			showErrorNotification(createNotifications().title(title).text(getMessage(e)));
	}

	/**
	 * Show an error notification.
	 * @param title
	 * @param message
	 */
	public static void showErrorNotification(final String title, final String message) {
		logger.error("{}: {}", title, message);
		if (!isHeadless())
			showErrorNotification(createNotifications().title(title).text(message));
	}

	private static String getMessage(Throwable e) {
		String message = e.getLocalizedMessage();
		if (message == null || message.isBlank())
			message = "DbView has encountered a problem, sorry.\n\n" + e;
		return message;
	}
	
	/**
	 * Show an error notification, making sure it is on the application thread
	 * @param notification
	 */
	private static void showErrorNotification(Notifications notification) {
		if (Platform.isFxApplicationThread())
			notification.showError();
		else
			Platform.runLater(() -> showErrorNotification(notification));
	}
	
	/**
	 * Notifications need an owner to be positioned relative to the main window.
	 */
	private static Notifications createNotifications() {
		var owner = getDefaultOwner();
		var notifications = Notifications.create();
		return owner == null ? notifications : notifications.owner(owner);
	}

	/**
	 * Get a default owner window.
	 * This is the primary window, if available, unless we have any modal stages.
	 * If we do have modal stages, and one is in focus, use that.
	 * Otherwise, return null and let JavaFX figure out the owner.
	 * @return
	 */
	static Window getDefaultOwner() {
		Comparator<Window> comparator = Comparator.comparing(Dialogs::isModal)
				.thenComparing(Window::isFocused)
				.thenComparing(w -> w == primaryWindow)
				.reversed();
		return Window.getWindows().stream()
				.sorted(comparator)
				.findFirst()
				.orElse(primaryWindow);
	}

	private static boolean isModal(Window window) {
		if (window instanceof Stage)
			return ((Stage)window).getModality() != Modality.NONE;
		return false;
	}
	
	/**
	 * Query whether dialogs can be shown. When no window is open (e.g. in tests or before startup), 
	 * messages are only logged.
	 * @return
	 */
	public static boolean isHeadless() {
		return Window.getWindows().isEmpty();
	}
	
	/**
	 * Builder class to create a custom {@link Dialog}.
	 */
	public static class Builder {
		
		private AlertType alertType;
		private String title = "";
		private Node content = null;
		private boolean resizable = false;
		private List<ButtonType> buttons = null;
		
		/**
		 * Specify the dialog title.
		 * @param title
		 * @return this builder
		 */
		public Builder title(String title) {
			this.title = title;
			return this;
		}
		
		/**
		 * Specify the dialog content.
		 * @param content
		 * @return this builder
		 */
		public Builder content(Node content) {
			this.content = content;
			return this;
		}
		
		/**
		 * Make the dialog resizable (but default it is not).
		 * @return this builder
		 */
		public Builder resizable() {
			this.resizable = true;
			return this;
		}
		
		/**
		 * Create an alert dialog of the specified type.
		 * @param type
		 * @return this builder
		 */
		public Builder alertType(AlertType type) {
			this.alertType = type;
			return this;
		}
		
		/**
		 * Specify the buttons to show.
		 * @param buttonTypes
		 * @return this builder
		 */
		public Builder buttons(ButtonType... buttonTypes) {
			this.buttons = List.of(buttonTypes);
			return this;
		}
		
		/**
		 * Build the dialog.
		 * @return a {@link Dialog} created with the specified features.
		 */
		public Dialog<ButtonType> build() {
			Dialog<ButtonType> dialog = alertType == null ? new Dialog<>() : new Alert(alertType);
			dialog.initOwner(getDefaultOwner());
			dialog.setTitle(title);
			// The alert type can otherwise add its own header
			dialog.setHeaderText(null);
			if (content != null)
				dialog.getDialogPane().setContent(content);
			if (buttons != null)
				dialog.getDialogPane().getButtonTypes().setAll(buttons);
			
			// We do need to be able to close the dialog somehow
			if (dialog.getDialogPane().getButtonTypes().isEmpty())
				dialog.getDialogPane().getScene().getWindow().setOnCloseRequest(e -> dialog.hide());
			
			dialog.setResizable(resizable);
			dialog.initModality(Modality.APPLICATION_MODAL);
			return dialog;
		}
		
		/**
		 * Show the dialog on the JavaFX application thread, without waiting.
		 */
		public void show() {
			if (isHeadless()) {
				logger.warn("Cannot show dialog in headless mode!");
				return;
			}
			FXUtils.runOnApplicationThread(() -> build().show());
		}
		
		/**
		 * Show the dialog on the JavaFX application thread, waiting until it is closed.
		 * @return the button pressed, or empty if the dialog could not be shown
		 */
		public Optional<ButtonType> showAndWait() {
			if (isHeadless()) {
				logger.warn("Cannot show dialog in headless mode!");
				return Optional.empty();
			}
			var result = FXUtils.callOnApplicationThread(() -> build().showAndWait());
			return result == null ? Optional.empty() : result;
		}
		
	}

}

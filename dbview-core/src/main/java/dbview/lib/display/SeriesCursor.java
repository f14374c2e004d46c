/*-
 * #%L
 * This file is part of DbView.
 * %%
 * Copyright (C) 2026 DbView developers
 * %%
 * DbView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * DbView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DbView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package dbview.lib.display;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import dbview.lib.common.GeneralTools;

/**
 * The current (z, t) selection of a 4D display.
 * <p>
 * Both positions are always within {@code [0, size - 1]}. Movement commands clamp to 
 * these bounds; there is no wraparound. Listeners are notified in the order they were added, 
 * and only when the selection actually changes.
 * 
 * @author DbView developers
 */
public class SeriesCursor {
	
	private static final Logger logger = LoggerFactory.getLogger(SeriesCursor.class);
	
	/**
	 * Axes of a 4D series that can be stepped through.
	 */
	public enum Axis {
		/**
		 * The view axis, shown as consecutive images.
		 */
		Z,
		/**
		 * The plot axis, shown along the x-axis of the curve plot.
		 */
		T
	}
	
	/**
	 * Direction of a movement command.
	 */
	public enum Direction {
		UP, DOWN;
		
		int step() {
			return this == UP ? 1 : -1;
		}
	}
	
	/**
	 * Directional keys recognized by {@link SeriesCursor#handleArrowKey(ArrowKey)}.
	 */
	public enum ArrowKey {
		LEFT, RIGHT, UP, DOWN
	}
	
	private int sizeZ = 1;
	private int sizeT = 1;
	private int z = 0;
	private int t = 0;
	
	private final List<SeriesCursorListener> listeners = new ArrayList<>();
	
	/**
	 * Create a cursor for a single frame.
	 */
	public SeriesCursor() {}
	
	/**
	 * Create a cursor positioned at (0, 0).
	 * @param sizeZ number of positions along the view axis
	 * @param sizeT number of positions along the plot axis
	 */
	public SeriesCursor(int sizeZ, int sizeT) {
		checkSize(sizeZ, sizeT);
		this.sizeZ = sizeZ;
		this.sizeT = sizeT;
	}
	
	private static void checkSize(int sizeZ, int sizeT) {
		if (sizeZ < 1 || sizeT < 1)
			throw new IllegalArgumentException("Cursor bounds must be >= 1, but were " + sizeZ + " and " + sizeT);
	}
	
	/**
	 * Change the number of positions along each axis.
	 * The current position is clamped to the new bounds, notifying listeners if it moves.
	 * @param sizeZ
	 * @param sizeT
	 */
	public void setBounds(int sizeZ, int sizeT) {
		checkSize(sizeZ, sizeT);
		this.sizeZ = sizeZ;
		this.sizeT = sizeT;
		setPosition(z, t);
	}
	
	/**
	 * Number of positions along the view axis.
	 * @return
	 */
	public int getSizeZ() {
		return sizeZ;
	}
	
	/**
	 * Number of positions along the plot axis.
	 * @return
	 */
	public int getSizeT() {
		return sizeT;
	}
	
	public int getZ() {
		return z;
	}
	
	public int getT() {
		return t;
	}
	
	/**
	 * Get the current position along an axis.
	 * @param axis
	 * @return
	 */
	public int get(Axis axis) {
		return axis == Axis.Z ? z : t;
	}
	
	/**
	 * Set the position along the view axis, clamped to bounds.
	 * @param z
	 * @return true if the position changed
	 */
	public boolean setZ(int z) {
		return setPosition(z, t);
	}
	
	/**
	 * Set the position along the plot axis, clamped to bounds.
	 * @param t
	 * @return true if the position changed
	 */
	public boolean setT(int t) {
		return setPosition(z, t);
	}
	
	/**
	 * Set the position along an axis, clamped to bounds.
	 * @param axis
	 * @param value
	 * @return true if the position changed
	 */
	public boolean set(Axis axis, int value) {
		return axis == Axis.Z ? setZ(value) : setT(value);
	}
	
	/**
	 * Set both positions, clamped to bounds, notifying listeners at most once.
	 * @param z
	 * @param t
	 * @return true if the position changed
	 */
	public boolean setPosition(int z, int t) {
		int zNew = GeneralTools.clipValue(z, 0, sizeZ - 1);
		int tNew = GeneralTools.clipValue(t, 0, sizeT - 1);
		if (zNew == this.z && tNew == this.t)
			return false;
		int zOld = this.z;
		int tOld = this.t;
		this.z = zNew;
		this.t = tNew;
		logger.trace("Cursor moved from ({}, {}) to ({}, {})", zOld, tOld, zNew, tNew);
		fireCursorChanged(zOld, tOld);
		return true;
	}
	
	/**
	 * Move one step along an axis.
	 * @param axis
	 * @param direction
	 * @return true if the position changed, false if it was already at the bound
	 */
	public boolean move(Axis axis, Direction direction) {
		return set(axis, get(axis) + direction.step());
	}
	
	/**
	 * Apply the standard key mapping: left and right step down and up the plot axis, 
	 * up and down step up and down the view axis.
	 * @param key
	 * @return true if the position changed
	 */
	public boolean handleArrowKey(ArrowKey key) {
		switch (key) {
		case LEFT:
			return move(Axis.T, Direction.DOWN);
		case RIGHT:
			return move(Axis.T, Direction.UP);
		case UP:
			return move(Axis.Z, Direction.UP);
		case DOWN:
			return move(Axis.Z, Direction.DOWN);
		default:
			throw new IllegalArgumentException("Unknown key " + key);
		}
	}
	
	/**
	 * Add a listener. Listeners are called in the order they were added.
	 * @param listener
	 */
	public void addListener(SeriesCursorListener listener) {
		listeners.add(listener);
	}
	
	/**
	 * Remove a listener.
	 * @param listener
	 */
	public void removeListener(SeriesCursorListener listener) {
		listeners.remove(listener);
	}
	
	private void fireCursorChanged(int zOld, int tOld) {
		// Copy so listeners may unsubscribe while being notified
		for (var listener : new ArrayList<>(listeners))
			listener.cursorChanged(this, zOld, tOld);
	}

	@Override
	public String toString() {
		return "SeriesCursor [z=" + z + "/" + sizeZ + ", t=" + t + "/" + sizeT + "]";
	}

}

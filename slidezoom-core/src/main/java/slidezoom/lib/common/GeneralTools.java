/*-
 * #%L
 * This file is part of SlideZoom.
 * %%
 * Copyright (C) 2026 SlideZoom developers
 * %%
 * SlideZoom is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SlideZoom is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SlideZoom.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package slidezoom.lib.common;

import java.text.NumberFormat;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Locale.Category;

import org.apache.commons.math3.util.Precision;

/**
 * Collection of generally useful static methods.
 */
public final class GeneralTools {

	// Suppressed default constructor for non-instantiability
	private GeneralTools() {
		throw new AssertionError();
	}

	/**
	 * Check if a string is blank, i.e. it is null or its length is 0.
	 * @param s
	 * @param trim If true, any string will be trimmed before its length checked.
	 * @return True if the string is null or empty.
	 */
	public static boolean blankString(final String s, final boolean trim) {
		return s == null || (trim ? s.trim().length() == 0 : s.length() == 0);
	}

	/**
	 * Test if two doubles are approximately equal, within a specified relative tolerance.
	 *
	 * @param n1
	 * @param n2
	 * @param tolerance
	 * @return
	 */
	public static boolean almostTheSame(double n1, double n2, double tolerance) {
		return Precision.equalsWithRelativeTolerance(n1, n2, tolerance);
	}

	/**
	 * Divide two positive integers, rounding the result up.
	 * <p>
	 * Equivalent to {@code (int)Math.ceil(numerator / (double)denominator)}, but without
	 * passing through floating point.
	 *
	 * @param numerator value to divide, must be &geq; 0
	 * @param denominator value to divide by, must be &gt; 0
	 * @return
	 */
	public static int ceilDiv(final int numerator, final int denominator) {
		if (denominator <= 0)
			throw new IllegalArgumentException("Denominator must be > 0! Requested " + denominator);
		if (numerator < 0)
			throw new IllegalArgumentException("Numerator must be >= 0! Requested " + numerator);
		return (int)((numerator + (long)denominator - 1) / denominator);
	}

	/**
	 * Cache of NumberFormat objects
	 */
	private static Map<Locale, NumberFormat> formatters = new HashMap<>();

	/**
	 * Format a value with a maximum number of decimal places, using the default Locale.
	 *
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public synchronized static String formatNumber(final double value, final int maxDecimalPlaces) {
		return formatNumber(Locale.getDefault(Category.FORMAT), value, maxDecimalPlaces);
	}

	/**
	 * Format a value with a maximum number of decimal places, using a specified Locale.
	 *
	 * @param locale
	 * @param value
	 * @param maxDecimalPlaces
	 * @return
	 */
	public synchronized static String formatNumber(final Locale locale, final double value, final int maxDecimalPlaces) {
		NumberFormat nf = formatters.get(locale);
		if (nf == null) {
			nf = NumberFormat.getInstance(locale);
			nf.setGroupingUsed(false);
			formatters.put(locale, nf);
		}
		nf.setMaximumFractionDigits(maxDecimalPlaces);
		return nf.format(value);
	}

}

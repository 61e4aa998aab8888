/*-
 * #%L
 * This file is part of Diffrax.
 * %%
 * Copyright (C) 2023 Diffrax developers
 * %%
 * Diffrax is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * Diffrax is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with Diffrax.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package diffrax.lib.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;

import diffrax.lib.model.Beam;
import diffrax.lib.model.Detector;
import diffrax.lib.model.Goniometer;
import diffrax.lib.model.Panel;
import diffrax.lib.model.Scan;

/**
 * Helper class for JSON serialization of the instrument models with Gson.
 */
public class GsonTools {

	private final static Logger logger = LoggerFactory.getLogger(GsonTools.class);

	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.setLenient()
			.registerTypeAdapterFactory(new ModelTypeAdapterFactory());

	// Suppress default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}

	/**
	 * Access the builder used with {@link #getInstance()}.
	 * This makes it possible to register new type adapters if required, which will be used by future Gson instances
	 * returned by this class.
	 * <p>
	 * To create a derived builder that inherits from the default but does not change it, use {@code getInstance().newBuilder()}.
	 *
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		logger.trace("Requesting default GsonBuilder");
		return builder;
	}

	static class ModelTypeAdapterFactory implements TypeAdapterFactory {

		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			TypeAdapter<T> adapter = getTypeAdaptor(type.getRawType());
			return adapter == null ? null : adapter.nullSafe();
		}

		@SuppressWarnings("unchecked")
		static <T> TypeAdapter<T> getTypeAdaptor(Class<? super T> cls) {
			if (Beam.class.equals(cls))
				return (TypeAdapter<T>)ModelTypeAdapters.BEAM_ADAPTER_INSTANCE;

			if (Goniometer.class.equals(cls))
				return (TypeAdapter<T>)ModelTypeAdapters.GONIOMETER_ADAPTER_INSTANCE;

			if (Panel.class.equals(cls))
				return (TypeAdapter<T>)ModelTypeAdapters.PANEL_ADAPTER_INSTANCE;

			if (Detector.class.equals(cls))
				return (TypeAdapter<T>)ModelTypeAdapters.DETECTOR_ADAPTER_INSTANCE;

			if (Scan.class.equals(cls))
				return (TypeAdapter<T>)ModelTypeAdapters.SCAN_ADAPTER_INSTANCE;

			return null;
		}

	}

	/**
	 * Get default Gson, capable of serializing/deserializing the instrument models.
	 * @return
	 *
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}

	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 *
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 *
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}

	/**
	 * Parse a scan using a template.
	 * Any field missing from the scan is taken from the template, and if the scan is null then the template is used
	 * in its place.
	 *
	 * @param json the JSON representation of the scan; may be null
	 * @param template the JSON representation of the template; may be null
	 * @return the scan, or null if neither the scan nor the template are available
	 * @throws JsonParseException if the scan cannot be parsed
	 */
	public static Scan parseScan(JsonElement json, JsonElement template) throws JsonParseException {
		return ModelTypeAdapters.parseScan(json, template);
	}

}

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

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import diffrax.lib.model.Beam;
import diffrax.lib.model.Detector;
import diffrax.lib.model.Goniometer;
import diffrax.lib.model.MaskRegion;
import diffrax.lib.model.Panel;
import diffrax.lib.model.Scan;

/**
 * Type adapters for the instrument models.
 * <p>
 * The JSON representations use the same field names as the dictionaries written by other
 * crystallography software, so that models can be exchanged.
 */
class ModelTypeAdapters {

	private static final Logger logger = LoggerFactory.getLogger(ModelTypeAdapters.class);

	static BeamTypeAdapter BEAM_ADAPTER_INSTANCE = new BeamTypeAdapter();
	static GoniometerTypeAdapter GONIOMETER_ADAPTER_INSTANCE = new GoniometerTypeAdapter();
	static PanelTypeAdapter PANEL_ADAPTER_INSTANCE = new PanelTypeAdapter();
	static DetectorTypeAdapter DETECTOR_ADAPTER_INSTANCE = new DetectorTypeAdapter();
	static ScanTypeAdapter SCAN_ADAPTER_INSTANCE = new ScanTypeAdapter();

	private static Gson gson = new GsonBuilder()
			.setLenient()
			.create();


	static class BeamTypeAdapter extends TypeAdapter<Beam> {

		@Override
		public void write(JsonWriter out, Beam beam) throws IOException {
			out.beginObject();
			out.name("direction");
			writeVector(out, beam.getDirection());
			out.name("wavelength");
			out.value(beam.getWavelength());
			out.endObject();
		}

		@Override
		public Beam read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			return new Beam(
					parseVector(requireMember(obj, "direction")),
					requireMember(obj, "wavelength").getAsDouble());
		}

	}


	static class GoniometerTypeAdapter extends TypeAdapter<Goniometer> {

		@Override
		public void write(JsonWriter out, Goniometer goniometer) throws IOException {
			out.beginObject();
			out.name("rotation_axis");
			writeVector(out, goniometer.getRotationAxis());
			out.name("fixed_rotation");
			out.beginArray();
			RealMatrix matrix = goniometer.getFixedRotation();
			for (int r = 0; r < 3; r++) {
				for (int c = 0; c < 3; c++)
					out.value(matrix.getEntry(r, c));
			}
			out.endArray();
			out.endObject();
		}

		@Override
		public Goniometer read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			Vector3D axis = parseVector(requireMember(obj, "rotation_axis"));
			if (!obj.has("fixed_rotation"))
				return new Goniometer(axis);
			double[] values = parseDoubles(obj.get("fixed_rotation"));
			if (values.length != 9)
				throw new JsonParseException("Fixed rotation must have 9 values, but found " + values.length);
			RealMatrix matrix = MatrixUtils.createRealMatrix(3, 3);
			for (int i = 0; i < 9; i++)
				matrix.setEntry(i / 3, i % 3, values[i]);
			return new Goniometer(axis, matrix);
		}

	}


	static class PanelTypeAdapter extends TypeAdapter<Panel> {

		@Override
		public void write(JsonWriter out, Panel panel) throws IOException {
			out.beginObject();
			out.name("type");
			out.value(panel.getType());
			out.name("fast_axis");
			writeVector(out, panel.getFastAxis());
			out.name("slow_axis");
			writeVector(out, panel.getSlowAxis());
			out.name("origin");
			writeVector(out, panel.getOrigin());
			out.name("pixel_size");
			writeDoubles(out, panel.getPixelSize());
			out.name("image_size");
			int[] imageSize = panel.getImageSize();
			out.beginArray();
			out.value(imageSize[0]);
			out.value(imageSize[1]);
			out.endArray();
			out.name("trusted_range");
			writeDoubles(out, panel.getTrustedRange());
			out.name("gain");
			out.value(panel.getGain());
			// Only write the mask if there is one
			if (!panel.getMask().isEmpty()) {
				out.name("mask");
				out.beginArray();
				for (MaskRegion region : panel.getMask()) {
					out.beginArray();
					out.value(region.getF0());
					out.value(region.getS0());
					out.value(region.getF1());
					out.value(region.getS1());
					out.endArray();
				}
				out.endArray();
			}
			out.endObject();
		}

		@Override
		public Panel read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			return parsePanel(obj);
		}

	}


	static class DetectorTypeAdapter extends TypeAdapter<Detector> {

		@Override
		public void write(JsonWriter out, Detector detector) throws IOException {
			out.beginObject();
			out.name("panels");
			out.beginArray();
			for (Panel panel : detector)
				PANEL_ADAPTER_INSTANCE.write(out, panel);
			out.endArray();
			out.endObject();
		}

		@Override
		public Detector read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			Detector detector = new Detector();
			for (JsonElement element : requireMember(obj, "panels").getAsJsonArray())
				detector.addPanel(parsePanel(element.getAsJsonObject()));
			return detector;
		}

	}


	static class ScanTypeAdapter extends TypeAdapter<Scan> {

		@Override
		public void write(JsonWriter out, Scan scan) throws IOException {
			int[] imageRange = scan.getImageRange();
			out.beginObject();
			out.name("image_range");
			out.beginArray();
			out.value(imageRange[0]);
			out.value(imageRange[1]);
			out.endArray();
			out.name("oscillation");
			writeDoubles(out, scan.getOscillation());
			out.name("exposure_time");
			writeDoubles(out, scan.getExposureTimes());
			out.name("epochs");
			writeDoubles(out, scan.getEpochs());
			out.name("batch_offset");
			out.value(scan.getBatchOffset());
			out.endObject();
		}

		@Override
		public Scan read(JsonReader in) throws IOException {
			JsonObject obj = gson.fromJson(in, JsonObject.class);
			return parseScan(obj, null);
		}

	}


	static Panel parsePanel(JsonObject obj) {
		String type = obj.has("type") ? obj.get("type").getAsString() : "Unknown";
		double[] pixelSize = parseDoubles(requireMember(obj, "pixel_size"));
		double[] trustedRange = parseDoubles(requireMember(obj, "trusted_range"));
		JsonArray imageSizeArray = requireMember(obj, "image_size").getAsJsonArray();
		int[] imageSize = new int[imageSizeArray.size()];
		for (int i = 0; i < imageSize.length; i++)
			imageSize[i] = imageSizeArray.get(i).getAsInt();

		Panel panel = new Panel(type,
				parseVector(requireMember(obj, "fast_axis")),
				parseVector(requireMember(obj, "slow_axis")),
				parseVector(requireMember(obj, "origin")),
				pixelSize, imageSize, trustedRange);

		if (obj.has("gain"))
			panel.setGain(obj.get("gain").getAsDouble());
		if (obj.has("mask")) {
			List<MaskRegion> mask = new ArrayList<>();
			for (JsonElement element : obj.getAsJsonArray("mask")) {
				JsonArray region = element.getAsJsonArray();
				if (region.size() != 4)
					throw new JsonParseException("Mask region must have 4 values, but found " + region);
				mask.add(new MaskRegion(
						region.get(0).getAsInt(), region.get(1).getAsInt(),
						region.get(2).getAsInt(), region.get(3).getAsInt()));
			}
			panel.setMask(mask);
		}
		return panel;
	}


	/**
	 * Parse a scan, optionally using a template to provide any missing fields.
	 * <p>
	 * A single exposure time is applied to every image, and missing exposure times are filled using the
	 * last value provided (or 0 if there are none). If there are more than two images but only two epochs,
	 * the remaining epochs are extrapolated from the first two.
	 *
	 * @param element the scan; may be null or {@link com.google.gson.JsonNull}
	 * @param template the template; may be null
	 * @return the scan, or null if both the scan and the template are missing
	 * @throws JsonParseException if the scan is incomplete, or the number of epochs does not match the number of images
	 */
	static Scan parseScan(JsonElement element, JsonElement template) {
		boolean hasTemplate = template != null && !template.isJsonNull();
		if (element == null || element.isJsonNull()) {
			if (!hasTemplate)
				return null;
			return parseScan(template, null);
		}

		JsonObject obj;
		if (hasTemplate) {
			obj = template.getAsJsonObject().deepCopy();
			for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet())
				obj.add(entry.getKey(), entry.getValue());
		} else
			obj = element.getAsJsonObject();

		JsonArray imageRange = requireMember(obj, "image_range").getAsJsonArray();
		int first = imageRange.get(0).getAsInt();
		int last = imageRange.get(1).getAsInt();
		double[] oscillation = parseDoubles(requireMember(obj, "oscillation"));
		if (oscillation.length != 2)
			throw new JsonParseException("Oscillation must have 2 values, but found " + oscillation.length);

		JsonElement exposureElement = requireMember(obj, "exposure_time");
		double[] exposureTimes;
		if (exposureElement.isJsonArray())
			exposureTimes = parseDoubles(exposureElement);
		else
			exposureTimes = new double[] {exposureElement.getAsDouble()};

		double[] epochs = parseDoubles(requireMember(obj, "epochs"));

		int numImages = last - first + 1;
		if (numImages > 2 && epochs.length == 2) {
			double diff = epochs[1] - epochs[0];
			double offset = epochs[1];
			double[] expanded = new double[numImages];
			expanded[0] = epochs[0];
			expanded[1] = epochs[1];
			for (int i = 0; i < numImages - 2; i++)
				expanded[i + 2] = offset + (i + 1) * diff;
			logger.debug("Extrapolated {} epochs from 2 values", numImages);
			epochs = expanded;
		} else if (epochs.length != numImages)
			throw new JsonParseException("Num epochs does not match num images");

		if (exposureTimes.length < numImages) {
			double fill = exposureTimes.length > 0 ? exposureTimes[exposureTimes.length - 1] : 0.0;
			double[] padded = new double[numImages];
			System.arraycopy(exposureTimes, 0, padded, 0, exposureTimes.length);
			for (int i = exposureTimes.length; i < numImages; i++)
				padded[i] = fill;
			exposureTimes = padded;
		}

		int batchOffset = obj.has("batch_offset") ? obj.get("batch_offset").getAsInt() : 0;
		return new Scan(first, last, oscillation[0], oscillation[1], exposureTimes, epochs, batchOffset);
	}


	static JsonElement requireMember(JsonObject obj, String name) {
		JsonElement element = obj.get(name);
		if (element == null || element.isJsonNull())
			throw new JsonParseException("Missing required field '" + name + "'");
		return element;
	}

	static Vector3D parseVector(JsonElement element) {
		double[] values = parseDoubles(element);
		if (values.length != 3)
			throw new JsonParseException("Expected 3 values for a vector, but found " + element);
		return new Vector3D(values);
	}

	static double[] parseDoubles(JsonElement element) {
		if (element instanceof JsonPrimitive)
			return new double[] {element.getAsDouble()};
		JsonArray array = element.getAsJsonArray();
		double[] values = new double[array.size()];
		for (int i = 0; i < values.length; i++)
			values[i] = array.get(i).getAsDouble();
		return values;
	}

	static void writeVector(JsonWriter out, Vector3D vector) throws IOException {
		out.beginArray();
		out.value(vector.getX());
		out.value(vector.getY());
		out.value(vector.getZ());
		out.endArray();
	}

	static void writeDoubles(JsonWriter out, double[] values) throws IOException {
		out.beginArray();
		for (double v : values)
			out.value(v);
		out.endArray();
	}

}

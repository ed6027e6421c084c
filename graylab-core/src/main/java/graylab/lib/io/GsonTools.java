/*-
 * #%L
 * This file is part of GrayLab.
 * %%
 * Copyright (C) 2024 - 2025 GrayLab developers
 * %%
 * GrayLab is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * GrayLab is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with GrayLab.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package graylab.lib.io;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;

import graylab.lib.analysis.stats.IntensityHistogram;
import graylab.lib.analysis.stats.IntensityMapping;
import graylab.lib.common.InvalidParameterException;
import graylab.lib.geom.TransformMatrix;
import graylab.lib.images.FloatImage;
import graylab.lib.images.GrayImage;

/**
 * Helper class providing Gson instances with type adapters registered to serialize 
 * the numeric artifacts returned by GrayLab operations.
 * <p>
 * These include:
 * <ul>
 * <li>{@link TransformMatrix}, as a nested 3x3 array</li>
 * <li>{@link IntensityMapping}, as an array of 256 entries with {@code null} for absent entries</li>
 * <li>{@link IntensityHistogram}, as an object with {@code counts}, {@code normalized} and {@code cumulative} arrays</li>
 * <li>{@link GrayImage} and {@link FloatImage}, as objects with {@code width}, {@code height} and {@code pixels}</li>
 * </ul>
 */
public class GsonTools {
	
	private final static Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.registerTypeAdapterFactory(new GrayLabTypeAdapterFactory());
	
	// Suppressed default constructor for non-instantiability
	private GsonTools() {
		throw new AssertionError();
	}
	
	/**
	 * Access the builder used with {@link #getInstance()}.
	 * <p>
	 * To create a derived builder that inherits from the default but does not change it, 
	 * use {@code GsonTools.getInstance().newBuilder()}.
	 * 
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		return builder;
	}
	
	/**
	 * Get default Gson, capable of serializing/deserializing GrayLab value types.
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
	
	
	static class GrayLabTypeAdapterFactory implements TypeAdapterFactory {

		@SuppressWarnings("unchecked")
		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			Class<? super T> cls = type.getRawType();
			TypeAdapter<?> adapter = null;
			if (TransformMatrix.class.equals(cls))
				adapter = TransformMatrixTypeAdapter.INSTANCE;
			else if (IntensityMapping.class.equals(cls))
				adapter = IntensityMappingTypeAdapter.INSTANCE;
			else if (IntensityHistogram.class.equals(cls))
				adapter = IntensityHistogramTypeAdapter.INSTANCE;
			else if (GrayImage.class.equals(cls))
				adapter = GrayImageTypeAdapter.INSTANCE;
			else if (FloatImage.class.equals(cls))
				adapter = FloatImageTypeAdapter.INSTANCE;
			if (adapter != null)
				logger.trace("Using {} for {}", adapter.getClass().getSimpleName(), cls);
			return adapter == null ? null : (TypeAdapter<T>)adapter.nullSafe();
		}
		
	}
	
	
	static class TransformMatrixTypeAdapter extends TypeAdapter<TransformMatrix> {
		
		static TransformMatrixTypeAdapter INSTANCE = new TransformMatrixTypeAdapter();

		@Override
		public void write(JsonWriter out, TransformMatrix value) throws IOException {
			out.beginArray();
			for (double[] row : value.toArray())
				writeArray(out, row);
			out.endArray();
		}

		@Override
		public TransformMatrix read(JsonReader in) throws IOException {
			List<double[]> rows = new ArrayList<>();
			in.beginArray();
			while (in.hasNext())
				rows.add(readDoubleArray(in));
			in.endArray();
			try {
				return TransformMatrix.fromRows(rows.toArray(double[][]::new));
			} catch (InvalidParameterException e) {
				throw new JsonParseException(e.getMessage(), e);
			}
		}
		
	}
	
	
	static class IntensityMappingTypeAdapter extends TypeAdapter<IntensityMapping> {
		
		static IntensityMappingTypeAdapter INSTANCE = new IntensityMappingTypeAdapter();

		@Override
		public void write(JsonWriter out, IntensityMapping value) throws IOException {
			out.beginArray();
			for (var entry : value.toList()) {
				if (entry.isPresent())
					out.value(entry.getAsInt());
				else
					out.nullValue();
			}
			out.endArray();
		}

		@Override
		public IntensityMapping read(JsonReader in) throws IOException {
			List<OptionalInt> entries = new ArrayList<>();
			in.beginArray();
			while (in.hasNext()) {
				if (in.peek() == JsonToken.NULL) {
					in.nextNull();
					entries.add(OptionalInt.empty());
				} else
					entries.add(OptionalInt.of(in.nextInt()));
			}
			in.endArray();
			try {
				return IntensityMapping.fromList(entries);
			} catch (InvalidParameterException e) {
				throw new JsonParseException(e.getMessage(), e);
			}
		}
		
	}
	
	
	static class IntensityHistogramTypeAdapter extends TypeAdapter<IntensityHistogram> {
		
		static IntensityHistogramTypeAdapter INSTANCE = new IntensityHistogramTypeAdapter();

		@Override
		public void write(JsonWriter out, IntensityHistogram value) throws IOException {
			out.beginObject();
			out.name("counts");
			out.beginArray();
			for (long c : value.getCounts())
				out.value(c);
			out.endArray();
			out.name("normalized");
			writeArray(out, value.getNormalizedCounts());
			out.name("cumulative");
			writeArray(out, value.getCumulative());
			out.endObject();
		}

		/**
		 * Only the counts are read; the derived arrays are recomputed.
		 */
		@Override
		public IntensityHistogram read(JsonReader in) throws IOException {
			long[] counts = null;
			in.beginObject();
			while (in.hasNext()) {
				if ("counts".equals(in.nextName())) {
					List<Long> values = new ArrayList<>();
					in.beginArray();
					while (in.hasNext())
						values.add(in.nextLong());
					in.endArray();
					counts = values.stream().mapToLong(Long::longValue).toArray();
				} else
					in.skipValue();
			}
			in.endObject();
			if (counts == null)
				throw new JsonParseException("Histogram JSON has no 'counts' field");
			try {
				return IntensityHistogram.fromCounts(counts);
			} catch (InvalidParameterException e) {
				throw new JsonParseException(e.getMessage(), e);
			}
		}
		
	}
	
	
	static class GrayImageTypeAdapter extends TypeAdapter<GrayImage> {
		
		static GrayImageTypeAdapter INSTANCE = new GrayImageTypeAdapter();

		@Override
		public void write(JsonWriter out, GrayImage value) throws IOException {
			out.beginObject();
			out.name("width").value(value.getWidth());
			out.name("height").value(value.getHeight());
			out.name("pixels");
			out.beginArray();
			for (int v : value.getValues())
				out.value(v);
			out.endArray();
			out.endObject();
		}

		@Override
		public GrayImage read(JsonReader in) throws IOException {
			int width = 0;
			int height = 0;
			int[] values = null;
			in.beginObject();
			while (in.hasNext()) {
				switch (in.nextName()) {
				case "width":
					width = in.nextInt();
					break;
				case "height":
					height = in.nextInt();
					break;
				case "pixels":
					values = readIntArray(in);
					break;
				default:
					in.skipValue();
				}
			}
			in.endObject();
			if (values == null)
				throw new JsonParseException("Image JSON has no 'pixels' field");
			try {
				return GrayImage.create(values, width, height);
			} catch (InvalidParameterException e) {
				throw new JsonParseException(e.getMessage(), e);
			}
		}
		
	}
	
	
	static class FloatImageTypeAdapter extends TypeAdapter<FloatImage> {
		
		static FloatImageTypeAdapter INSTANCE = new FloatImageTypeAdapter();

		@Override
		public void write(JsonWriter out, FloatImage value) throws IOException {
			out.beginObject();
			out.name("width").value(value.getWidth());
			out.name("height").value(value.getHeight());
			out.name("pixels");
			out.beginArray();
			for (float v : value.getPixels())
				out.value(v);
			out.endArray();
			out.endObject();
		}

		@Override
		public FloatImage read(JsonReader in) throws IOException {
			int width = 0;
			int height = 0;
			double[] pixels = null;
			in.beginObject();
			while (in.hasNext()) {
				switch (in.nextName()) {
				case "width":
					width = in.nextInt();
					break;
				case "height":
					height = in.nextInt();
					break;
				case "pixels":
					pixels = readDoubleArray(in);
					break;
				default:
					in.skipValue();
				}
			}
			in.endObject();
			if (pixels == null)
				throw new JsonParseException("Image JSON has no 'pixels' field");
			float[] values = new float[pixels.length];
			for (int i = 0; i < pixels.length; i++)
				values[i] = (float)pixels[i];
			try {
				return FloatImage.create(values, width, height);
			} catch (InvalidParameterException e) {
				throw new JsonParseException(e.getMessage(), e);
			}
		}
		
	}
	
	
	private static void writeArray(JsonWriter out, double[] values) throws IOException {
		out.beginArray();
		for (double v : values)
			out.value(v);
		out.endArray();
	}
	
	/**
	 * Read an array of integers. Values with a fractional part are rejected rather than truncated.
	 */
	private static int[] readIntArray(JsonReader in) throws IOException {
		List<Integer> values = new ArrayList<>();
		in.beginArray();
		while (in.hasNext()) {
			try {
				values.add(in.nextInt());
			} catch (NumberFormatException e) {
				throw new JsonParseException("Expected an integer pixel value at " + in.getPath(), e);
			}
		}
		in.endArray();
		return values.stream().mapToInt(Integer::intValue).toArray();
	}
	
	private static double[] readDoubleArray(JsonReader in) throws IOException {
		List<Double> values = new ArrayList<>();
		in.beginArray();
		while (in.hasNext())
			values.add(in.nextDouble());
		in.endArray();
		return values.stream().mapToDouble(Double::doubleValue).toArray();
	}
	
}

package modulardm;

import java.util.List;
import java.util.Map;

import org.json.JSONObject;

/**
 * Control types used throughout the tests. They are nested classes so that a
 * container created with {@link #newContainer()} resolves type 'room' to
 * {@link Room} through {@link modulardm.resolver.LocationTypeResolver}.
 */
public class TestData {

	public static class House extends Control {
		public String streetNumber = "12";
		public String description = "";
		public boolean occupied = false;
		public String[] tags = { "brick" };

		public String _note = "not a property";
		public Object owner = null;
		public static int CONSTANT = 3;
	}

	public static class Room extends Control {
		public int doors = 1;
		public int windows = 1;
	}

	public static class Kitchen extends Room {
		public int windows = 3;
		public boolean hasOven = true;
	}

	public static class Meter extends Control {
		public int count = 0;
		public double level = Double.NaN;
		public byte step = 1;
	}

	public static class Garden extends Control {
		public String typeName = "garden";
		public String remove = "no";
		public String hidden = "no";
		public List<String> flowers = null;
		public Map<String, Object> layout = null;
		public double area;
	}

	public static class InitRecorder extends Control {
		public String label = "";

		public String _labelSeenInInit;
		public int _initCalls;

		@Override
		protected void init() {
			_labelSeenInInit = getProperty("label", String.class);
			++_initCalls;
		}
	}

	public static class Exploding extends Control {
		public Exploding() {
			throw new IllegalStateException("Simulated failure");
		}
	}

	public static abstract class AbstractThing extends Control {
	}

	public static class NoDefaultConstructor extends Control {
		public NoDefaultConstructor(int size) {
		}
	}

	public static class NotAControl {
	}

	public static TopLevelContainer newContainer() {
		return new TopLevelContainer(TestData.class.getName());
	}

	/**
	 * <code>{house1: {typeName: house, room1: {typeName: room, windows: 2}}}</code>
	 */
	public static JSONObject houseWithRoom() {
		return new JSONObject() //
				.put("house1", new JSONObject() //
						.put("typeName", "house") //
						.put("room1", new JSONObject() //
								.put("typeName", "room") //
								.put("windows", 2)));
	}

	public static TopLevelContainer newHouseTree() {
		final TopLevelContainer root = newContainer();
		root.set(houseWithRoom());
		return root;
	}
}

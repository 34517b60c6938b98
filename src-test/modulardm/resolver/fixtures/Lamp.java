package modulardm.resolver.fixtures;

import modulardm.Control;

public class Lamp extends Control {
	public boolean on = false;
	public int brightness = 100;
}

package org.pat2vec.model;

public enum WindowSource {
	GLOBAL,
	OVERRIDE,
	CONTROL_FULL,
	CONTROL_RANDOM
}

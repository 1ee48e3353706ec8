package com.obsinity.autometrics.config;

/** Where an instrumentation annotation was declared. */
public enum DeclarationTarget {
	METHOD,
	TYPE
}

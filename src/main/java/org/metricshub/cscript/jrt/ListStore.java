package org.metricshub.cscript.jrt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * CScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Named, ordered and mutable sequences of values. List names live in their
 * own namespace, so a list and a variable may share a name.
 */
public class ListStore {

	private final Map<String, List<Value>> lists = new HashMap<String, List<Value>>();

	/**
	 * Creates an empty list, replacing any existing list of the same name.
	 *
	 * @param name list name
	 */
	public void create(String name) {
		lists.put(name, new ArrayList<Value>());
	}

	public boolean contains(String name) {
		return lists.containsKey(name);
	}

	public void append(String name, Value value) {
		getList(name).add(value);
	}

	/**
	 * Removes the first element equal to the specified value.
	 *
	 * @param name list name
	 * @param value value to remove
	 * @return {@code true} if an element was removed
	 */
	public boolean remove(String name, Value value) {
		return getList(name).remove(value);
	}

	public int length(String name) {
		return getList(name).size();
	}

	/**
	 * Keeps only the elements accepted by the predicate, in their original
	 * order. If the predicate throws, the list is left untouched.
	 *
	 * @param name list name
	 * @param keep predicate deciding which elements survive
	 */
	public void filter(String name, Predicate<Value> keep) {
		List<Value> current = getList(name);
		List<Value> kept = new ArrayList<Value>(current.size());
		for (Value element : current) {
			if (keep.test(element)) {
				kept.add(element);
			}
		}
		lists.put(name, kept);
	}

	/**
	 * @param name list name
	 * @return a read-only view of the list
	 * @throws ScriptRuntimeException if no such list exists
	 */
	public List<Value> get(String name) {
		return Collections.unmodifiableList(getList(name));
	}

	private List<Value> getList(String name) {
		List<Value> list = lists.get(name);
		if (list == null) {
			throw new ScriptRuntimeException("List '" + name + "' not defined");
		}
		return list;
	}
}

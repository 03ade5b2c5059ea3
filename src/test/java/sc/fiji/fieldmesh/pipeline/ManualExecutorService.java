/*-
 * #%L
 * Fiji distribution of ImageJ for the life sciences.
 * %%
 * Copyright (C) 2010 - 2026 Fiji developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package sc.fiji.fieldmesh.pipeline;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Executor holding submitted tasks until the test decides to run them, so that
 * completion order can be controlled.
 */
class ManualExecutorService extends AbstractExecutorService {

	private final List<Runnable> pending = new ArrayList<>();
	private boolean shutdown;

	@Override
	public synchronized void execute(final Runnable command) {
		pending.add(command);
	}

	int pendingCount() {
		return pending.size();
	}

	/** Runs the {@code index}-th pending task (in submission order) */
	void run(final int index) {
		pending.remove(index).run();
	}

	void runAll() {
		while (!pending.isEmpty())
			run(0);
	}

	@Override
	public synchronized void shutdown() {
		shutdown = true;
	}

	@Override
	public synchronized List<Runnable> shutdownNow() {
		shutdown = true;
		final List<Runnable> list = new ArrayList<>(pending);
		pending.clear();
		return Collections.unmodifiableList(list);
	}

	@Override
	public synchronized boolean isShutdown() {
		return shutdown;
	}

	@Override
	public synchronized boolean isTerminated() {
		return shutdown && pending.isEmpty();
	}

	@Override
	public boolean awaitTermination(final long timeout, final TimeUnit unit) {
		return isTerminated();
	}

}

////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmanager.documents;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe {@link FileContentProvider} with unsaved-content overlays and a
 * disk-read cache.
 *
 * <p>An overlay set through {@link #setContents} is authoritative until it
 * is cleared. Otherwise disk content is cached and reused as long as the
 * file's modification time and size are unchanged; a write reported through
 * {@link #invalidate} drops the cached copy even if neither moved (coarse
 * mtime resolution).</p>
 */
public class FileContentsTracker implements FileContentProvider {

	private final ConcurrentHashMap<Path, String> overlays = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<Path, CachedContent> diskCache = new ConcurrentHashMap<>();

	/** Disk content plus the attributes it was read under. */
	private static final class CachedContent {
		final String content;
		final long modifiedMillis;
		final long size;

		CachedContent(String content, long modifiedMillis, long size) {
			this.content = content;
			this.modifiedMillis = modifiedMillis;
			this.size = size;
		}

		boolean matches(BasicFileAttributes attributes) {
			return attributes.lastModifiedTime().toMillis() == modifiedMillis && attributes.size() == size;
		}
	}

	@Override
	public String getContents(Path file) throws IOException {
		Path key = normalize(file);
		String overlay = overlays.get(key);
		if (overlay != null) {
			return overlay;
		}

		BasicFileAttributes attributes = Files.readAttributes(key, BasicFileAttributes.class);
		CachedContent cached = diskCache.get(key);
		if (cached != null && cached.matches(attributes)) {
			return cached.content;
		}
		try {
			String content = Files.readString(key);
			diskCache.put(key, new CachedContent(content, attributes.lastModifiedTime().toMillis(),
					attributes.size()));
			return content;
		} catch (IOException e) {
			diskCache.remove(key);
			throw e;
		}
	}

	/**
	 * Installs unsaved content for a file, shadowing what is on disk.
	 */
	public void setContents(Path file, String contents) {
		overlays.put(normalize(file), contents);
	}

	public void clearContents(Path file) {
		overlays.remove(normalize(file));
	}

	public boolean hasOverlay(Path file) {
		return overlays.containsKey(normalize(file));
	}

	public Set<Path> getOverlayPaths() {
		return Collections.unmodifiableSet(overlays.keySet());
	}

	@Override
	public void invalidate(Path file) {
		diskCache.remove(normalize(file));
	}

	public void invalidateAll() {
		diskCache.clear();
	}

	private static Path normalize(Path file) {
		return file.toAbsolutePath().normalize();
	}
}

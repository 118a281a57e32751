package org.springaicommunity.courtlistener.collector;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Contents of the user index file: which output files were saved for which user.
 *
 * <pre>
 * {"users": [{"username": "alice", "saved_files": ["data/alice_opinions.jsonl"]}]}
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserIndex(@JsonProperty("users") List<Entry> users) {

	public UserIndex {
		users = users != null ? List.copyOf(users) : List.of();
	}

	public static UserIndex empty() {
		return new UserIndex(List.of());
	}

	public Optional<Entry> find(String username) {
		return users.stream().filter(u -> u.username().equals(username)).findFirst();
	}

	/**
	 * Return a copy with the file registered for the user. The user is created if absent
	 * and a file already listed is not repeated.
	 */
	public UserIndex withFile(String username, String file) {
		List<Entry> updated = new ArrayList<>();
		boolean found = false;
		for (Entry entry : users) {
			if (entry.username().equals(username)) {
				updated.add(entry.withFile(file));
				found = true;
			}
			else {
				updated.add(entry);
			}
		}
		if (!found) {
			updated.add(new Entry(username, List.of(file)));
		}
		return new UserIndex(updated);
	}

	/**
	 * One user and the files saved for them, oldest first.
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Entry(@JsonProperty("username") String username,
			@JsonProperty("saved_files") List<String> savedFiles) {

		public Entry {
			savedFiles = savedFiles != null ? List.copyOf(savedFiles) : List.of();
		}

		Entry withFile(String file) {
			if (savedFiles.contains(file)) {
				return this;
			}
			List<String> files = new ArrayList<>(savedFiles);
			files.add(file);
			return new Entry(username, files);
		}

	}

}

package com.ai.codescope.service;

import com.ai.codescope.dto.FileNode;
import com.ai.codescope.dto.ManifestEntry;
import com.ai.codescope.model.IndexedFile;
import com.ai.codescope.model.RepositorySnapshot;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Category manifest and folder tree views of a snapshot.
 */
@Service
public class ManifestService {

    static final String ROOT_CATEGORY = "Other";
    static final String CATEGORY_SEPARATOR = " > ";
    static final int MAX_CATEGORY_DEPTH = 5;

    private static final Set<String> NOISE_DIRS = Set.of(
            "src", "lib", "Source", "Private", "Public", "Internal", "Include");

    /**
     * Files grouped by category, categories and entries in ascending order.
     */
    public SortedMap<String, List<ManifestEntry>> manifest(RepositorySnapshot snapshot) {
        SortedMap<String, List<ManifestEntry>> manifest = new TreeMap<>();
        for (IndexedFile file : snapshot.files()) {
            manifest.computeIfAbsent(category(file.path()), k -> new ArrayList<>())
                    .add(new ManifestEntry(file.path(), FileDescriptions.describe(file.path()), file.byteSize()));
        }
        return manifest;
    }

    static String category(String path) {
        String[] segments = path.split("/");
        if (segments.length <= 1) {
            return ROOT_CATEGORY;
        }
        List<String> kept = Arrays.stream(segments, 0, segments.length - 1)
                .filter(segment -> !NOISE_DIRS.contains(segment))
                .limit(MAX_CATEGORY_DEPTH)
                .toList();
        return kept.isEmpty() ? ROOT_CATEGORY : String.join(CATEGORY_SEPARATOR, kept);
    }

    /**
     * Folder hierarchy of the snapshot: folders before files, each group by name.
     */
    public List<FileNode> tree(RepositorySnapshot snapshot) {
        Node root = new Node("", "");
        for (IndexedFile file : snapshot.files()) {
            String[] parts = file.path().split("/");
            Node current = root;
            String currentPath = "";

            for (int i = 0; i < parts.length; i++) {
                String part = parts[i];
                currentPath = currentPath.isEmpty() ? part : currentPath + "/" + part;
                if (i == parts.length - 1) {
                    current.files.put(part, file);
                } else {
                    String folderPath = currentPath;
                    current = current.folders.computeIfAbsent(part, name -> new Node(name, folderPath));
                }
            }
        }
        return root.toFileNodes();
    }

    private static final class Node {
        final String name;
        final String path;
        final Map<String, Node> folders = new TreeMap<>();
        final Map<String, IndexedFile> files = new TreeMap<>();

        Node(String name, String path) {
            this.name = name;
            this.path = path;
        }

        List<FileNode> toFileNodes() {
            List<FileNode> nodes = new ArrayList<>(folders.size() + files.size());
            for (Node folder : folders.values()) {
                nodes.add(new FileNode(folder.path, folder.name, "folder", folder.path, null, null,
                        folder.toFileNodes()));
            }
            files.values().forEach(file -> nodes.add(new FileNode(file.path(), file.filename(), "file", file.path(),
                            file.byteSize(), file.language(), null)));
            return nodes;
        }
    }
}

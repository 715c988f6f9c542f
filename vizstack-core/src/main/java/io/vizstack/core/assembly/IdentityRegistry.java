package io.vizstack.core.assembly;

import io.vizstack.core.fragment.FragmentId;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/// Arena of the nodes discovered during one assembly run.
///
/// Each node is registered once, keyed by reference identity, and receives an integer handle
/// in registration order. The registry keeps the node instance alive until the run ends, so a
/// handle stays valid after the caller drops its own reference.
///
/// @implNote Not thread-safe. Scoped to a single run of {@link ViewAssembler}.
final class IdentityRegistry {

    private final Map<Object, Integer> handles = new IdentityHashMap<>();
    private final List<Object> nodes = new ArrayList<>();
    private final List<FragmentId> ids = new ArrayList<>();

    /// Returns the handle of a registered node.
    ///
    /// @param node node instance, not null
    /// @return handle, or -1 if the node has not been registered
    int find(Object node) {
        Integer handle = handles.get(node);
        return handle != null ? handle : -1;
    }

    /// Registers a node under an id.
    ///
    /// @param node node instance not yet registered, not null
    /// @param id   fragment id of the node, not null
    /// @return new handle
    int register(Object node, FragmentId id) {
        int handle = nodes.size();
        if (handles.putIfAbsent(node, handle) != null) {
            throw new IllegalStateException(
                    "Node already registered as " + idOf(handles.get(node)));
        }
        nodes.add(node);
        ids.add(id);
        return handle;
    }

    Object nodeOf(int handle) {
        return nodes.get(handle);
    }

    FragmentId idOf(int handle) {
        return ids.get(handle);
    }

    int size() {
        return nodes.size();
    }
}

package io.vizstack.core.assembly;

import io.vizstack.core.assembly.spi.DefaultViewResolver;
import io.vizstack.core.exception.AssemblyException;
import io.vizstack.core.exception.UnresolvedFragmentException;
import io.vizstack.core.fragment.Assembly;
import io.vizstack.core.fragment.Fragment;
import io.vizstack.core.fragment.FragmentAssembler;
import io.vizstack.core.fragment.FragmentId;
import io.vizstack.core.fragment.FragmentIdResolver;
import io.vizstack.core.fragment.View;
import io.vizstack.core.fragment.Viewable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Flattens a graph of fragment assemblers into a {@link View}.
///
/// The graph may share nodes and contain cycles. Each distinct node instance (by reference
/// identity) becomes exactly one fragment. Its id is assigned the first time a parent
/// references it, before its contents are computed; later references, including references
/// back from its own descendants, reuse that id. The root node always receives the configured
/// root id.
///
/// ### Algorithm
/// 1. The root is registered under the root id and pushed onto a LIFO worklist.
/// 2. A popped node whose fragment is already resolved is skipped.
/// 3. Otherwise the node's assembler is obtained and asked to assemble itself. Its
///    {@link FragmentIdResolver} returns the existing id of a known child, or mints a new id
///    with the {@link FragmentIdScheme}, marks it pending and pushes the child.
/// 4. The returned fragment is stored under the node's id and the referenced children are
///    pushed.
/// 5. When the worklist is empty, every id must map to a resolved fragment.
///
/// A popped node is converted to an assembler as follows: a {@link FragmentAssembler} is used
/// as is, a {@link Viewable} supplies one through {@link Viewable#view()}, and any other value
/// goes to the {@link DefaultViewResolver}.
///
/// ### Contracts
/// - **Precondition**: the graph is not mutated while a run is in progress
/// - **Postcondition**: every id referenced by a fragment of the view is a key of the table
/// - **Determinism**: the same graph yields the same view, ids included
///
/// @implNote Thread-safe. All run state is local to {@link #assemble(Object)}; one instance may
/// serve concurrent runs over graphs that are not shared between threads.
///
/// @see io.vizstack.core.VizstackFactory for wiring an instance from configuration
public class ViewAssembler {

    private static final Logger logger = Logger.getLogger(ViewAssembler.class.getName());

    private final FragmentId rootId;
    private final FragmentIdScheme idScheme;
    private final DefaultViewResolver defaultViewResolver;
    private final boolean verifyClosure;

    /// Creates an assembler.
    ///
    /// @param rootId              id given to the entry node, not null
    /// @param idScheme            scheme minting child ids, not null
    /// @param defaultViewResolver resolver for plain values, not null
    /// @param verifyClosure       whether to check every emitted reference against the table
    public ViewAssembler(
            FragmentId rootId,
            FragmentIdScheme idScheme,
            DefaultViewResolver defaultViewResolver,
            boolean verifyClosure) {
        this.rootId = Objects.requireNonNull(rootId, "rootId must not be null");
        this.idScheme = Objects.requireNonNull(idScheme, "idScheme must not be null");
        this.defaultViewResolver =
                Objects.requireNonNull(defaultViewResolver, "defaultViewResolver must not be null");
        this.verifyClosure = verifyClosure;
    }

    /// Assembles the graph reachable from `root`.
    ///
    /// @param root entry node, not null
    /// @return the assembled view, never null
    /// @throws NullPointerException if `root` is null
    /// @throws IllegalArgumentException if a layout holds a null child
    /// @throws AssemblyException if a layout is incomplete, a reference dangles, a value
    ///     cannot be viewed, or an id is referenced but never resolved
    public View assemble(Object root) {
        Objects.requireNonNull(root, "root must not be null");
        logger.fine("Assembling view from " + root.getClass().getSimpleName());

        Run run = new Run();
        run.push(run.registry.register(root, rootId));
        run.fragments.put(rootId, null);

        while (!run.worklist.isEmpty()) {
            int handle = run.worklist.pop();
            FragmentId id = run.registry.idOf(handle);
            if (run.fragments.get(id) != null) {
                continue;
            }
            FragmentAssembler assembler = toAssembler(run.registry.nodeOf(handle));
            Assembly assembly = assembler.assemble(run.resolverFor(id));
            run.fragments.put(id, assembly.fragment());
            if (logger.isLoggable(Level.FINEST)) {
                logger.finest("Resolved " + assembly.fragment().type().wireName() + " " + id);
            }
            for (Object child : assembly.references()) {
                int childHandle = child != null ? run.registry.find(child) : -1;
                if (childHandle < 0) {
                    throw new UnresolvedFragmentException(
                            "Fragment '" + id + "' references a child that was given no id",
                            id.value());
                }
                run.push(childHandle);
            }
        }

        for (Map.Entry<FragmentId, Fragment> entry : run.fragments.entrySet()) {
            if (entry.getValue() == null) {
                throw new UnresolvedFragmentException(
                        "Fragment '" + entry.getKey() + "' was referenced but never resolved",
                        entry.getKey().value());
            }
        }
        if (verifyClosure) {
            verifyClosure(run.fragments);
        }

        logger.fine("Assembled view with " + run.fragments.size() + " fragments");
        return new View(rootId, run.fragments);
    }

    public FragmentId getRootId() {
        return rootId;
    }

    public FragmentIdScheme getIdScheme() {
        return idScheme;
    }

    private FragmentAssembler toAssembler(Object node) {
        if (node instanceof FragmentAssembler assembler) {
            return assembler;
        }
        FragmentAssembler assembler =
                node instanceof Viewable viewable
                        ? viewable.view()
                        : defaultViewResolver.resolve(node);
        if (assembler == null) {
            throw new IllegalStateException(
                    "No assembler produced for " + node.getClass().getName());
        }
        return assembler;
    }

    private static void verifyClosure(Map<FragmentId, Fragment> fragments) {
        for (Map.Entry<FragmentId, Fragment> entry : fragments.entrySet()) {
            for (FragmentId reference : entry.getValue().references()) {
                if (!fragments.containsKey(reference)) {
                    throw new UnresolvedFragmentException(
                            "Fragment '"
                                    + entry.getKey()
                                    + "' references unknown fragment '"
                                    + reference
                                    + "'",
                            reference.value());
                }
            }
        }
    }

    /// Mutable state of one assembly run.
    private final class Run {

        private final IdentityRegistry registry = new IdentityRegistry();
        // null marks an id that is assigned but not yet resolved
        private final Map<FragmentId, Fragment> fragments = new LinkedHashMap<>();
        private final Deque<Integer> worklist = new ArrayDeque<>();

        private void push(int handle) {
            worklist.push(handle);
        }

        private FragmentIdResolver resolverFor(FragmentId parentId) {
            return (child, slot) -> getId(child, slot, parentId);
        }

        private FragmentId getId(Object child, String slot, FragmentId parentId) {
            if (child == null) {
                throw new IllegalArgumentException(
                        "Null child in slot '" + slot + "' of fragment '" + parentId + "'");
            }
            int handle = registry.find(child);
            if (handle >= 0) {
                return registry.idOf(handle);
            }
            FragmentId id = idScheme.newId(slot, parentId);
            if (fragments.containsKey(id)) {
                throw new AssemblyException(
                        "Id '"
                                + id
                                + "' minted for slot '"
                                + slot
                                + "' of fragment '"
                                + parentId
                                + "' is already in use",
                        id.value());
            }
            fragments.put(id, null);
            push(registry.register(child, id));
            return id;
        }
    }
}

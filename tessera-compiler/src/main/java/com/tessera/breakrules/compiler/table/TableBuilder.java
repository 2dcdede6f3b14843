/*
 * Copyright (c) 2025 Tessera Break Rules
 * Licensed under the Apache License, Version 2.0
 */
package com.tessera.breakrules.compiler.table;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.lang.UProperty;
import com.tessera.breakrules.api.exceptions.RuleCompilationException;
import com.tessera.breakrules.api.model.CharCategory;
import com.tessera.breakrules.api.model.RuleErrorCode;
import com.tessera.breakrules.compiler.parse.NodeArena;
import com.tessera.breakrules.compiler.parse.NodeType;
import com.tessera.breakrules.compiler.parse.ParsedRules;
import com.tessera.breakrules.compiler.parse.RuleNode;
import com.tessera.breakrules.compiler.parse.RuleTree;
import com.tessera.breakrules.compiler.parse.SetLeaf;
import com.tessera.breakrules.compiler.sets.CategoryBuilder;
import com.tessera.breakrules.runtime.model.RuleDataFormat;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the forward state table from the parsed forward rules, and derives
 * the safe reverse table from it.
 *
 * <p>The forward table is a DFA built by subset construction over followpos
 * sets of the rule tree positions. Rows are states, columns are character
 * categories. Row 0 is the stop state and row 1 the start state.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TableBuilder tables = new TableBuilder(parsed, categories, config.maxStates());
 * tables.buildForwardTable();
 * new TableMinimizer(tables, categories).minimize();
 * tables.buildSafeReverseTable();
 * tables.exportTable(buffer);
 * }</pre>
 */
public final class TableBuilder {

    private static final Logger logger = Logger.getLogger(TableBuilder.class.getName());

    private final ParsedRules rules;
    private final CategoryBuilder categories;
    private final int maxStates;
    private final NodeArena arena = new NodeArena();
    private final List<StateDescriptor> states = new ArrayList<>();
    private final List<IntArrayList> safeTable = new ArrayList<>();

    private int tree = RuleNode.NONE;
    private int userRoot = RuleNode.NONE;
    private int bofNode = RuleNode.NONE;
    private int endMarkNode = RuleNode.NONE;

    private boolean[] nullable;
    private IntSortedSet[] firstPos;
    private IntSortedSet[] lastPos;
    private IntSortedSet[] followPos;

    public TableBuilder(ParsedRules rules, CategoryBuilder categories, int maxStates) {
        this.rules = rules;
        this.categories = categories;
        this.maxStates = maxStates;
    }

    /**
     * Builds the forward table. Categories must already be built.
     *
     * @throws RuleCompilationException with {@code INTERNAL_ERROR} if the table exceeds the state limit
     */
    public void buildForwardTable() {
        int source = rules.root(RuleTree.FORWARD);
        if (source == RuleNode.NONE) {
            throw new RuleCompilationException(RuleErrorCode.INTERNAL_ERROR, "No forward rule tree");
        }
        userRoot = flatten(source);
        tree = userRoot;

        if (categories.sawBOF()) {
            bofNode = arena.add(RuleNode.leafChar(CharCategory.BEGIN_OF_TEXT.value()));
            tree = arena.add(RuleNode.binary(NodeType.CAT, bofNode, tree));
        }
        endMarkNode = arena.add(RuleNode.endMark(0, false));
        tree = arena.add(RuleNode.binary(NodeType.CAT, tree, endMarkNode));

        int size = arena.size();
        nullable = new boolean[size];
        firstPos = new IntSortedSet[size];
        lastPos = new IntSortedSet[size];
        followPos = new IntSortedSet[size];
        for (int i = 0; i < size; i++) {
            followPos[i] = new IntRBTreeSet();
        }

        calcPositions(tree);
        calcFollowPos(tree);
        if (rules.options().chainRules()) {
            calcChainedFollowPos();
        }
        if (bofNode != RuleNode.NONE) {
            bofFixup();
        }
        buildStateTable();
        flagAcceptingStates();
        flagLookAheadStates();
        flagTaggedStates();

        logger.fine(() -> String.format("Forward table: %d states, %d categories, %d tree nodes",
                states.size(), numCategories(), arena.size()));
    }

    // Copies the rule tree into the working arena. Variable references are
    // replaced by copies of their definitions and set references by an OR of
    // the set's categories; both replacements keep the rule root flags.
    private int flatten(int source) {
        RuleNode node = rules.arena().get(source);
        switch (node.type()) {
            case VAR_REF -> {
                int copied = flatten(node.left());
                arena.get(copied).inheritRootFlags(node);
                return copied;
            }
            case SET_REF -> {
                SetLeaf leaf = rules.setLeaves().get(node.setLeaf());
                IntList cats = leaf.categories();
                if (cats.isEmpty()) {
                    throw new RuleCompilationException(RuleErrorCode.INTERNAL_ERROR,
                            "Set has no categories: " + leaf.sourceText());
                }
                int result = arena.add(RuleNode.leafChar(cats.getInt(0)));
                for (int i = 1; i < cats.size(); i++) {
                    int next = arena.add(RuleNode.leafChar(cats.getInt(i)));
                    result = arena.add(RuleNode.binary(NodeType.OR, result, next));
                }
                arena.get(result).inheritRootFlags(node);
                return result;
            }
            default -> {
                RuleNode copy = node.copy();
                int index = arena.add(copy);
                int left = node.left() == RuleNode.NONE ? RuleNode.NONE : flatten(node.left());
                int right = node.right() == RuleNode.NONE ? RuleNode.NONE : flatten(node.right());
                copy.setChildren(left, right);
                return index;
            }
        }
    }

    private void calcPositions(int n) {
        RuleNode node = arena.get(n);
        NodeType type = node.type();
        if (type.isPosition()) {
            nullable[n] = type == NodeType.LOOK_AHEAD || type == NodeType.TAG;
            firstPos[n] = singleton(n);
            lastPos[n] = singleton(n);
            return;
        }
        int l = node.left();
        int r = node.right();
        calcPositions(l);
        if (r != RuleNode.NONE) {
            calcPositions(r);
        }
        switch (type) {
            case OR -> {
                nullable[n] = nullable[l] || nullable[r];
                firstPos[n] = union(firstPos[l], firstPos[r]);
                lastPos[n] = union(lastPos[l], lastPos[r]);
            }
            case CAT -> {
                nullable[n] = nullable[l] && nullable[r];
                firstPos[n] = nullable[l] ? union(firstPos[l], firstPos[r]) : new IntRBTreeSet(firstPos[l]);
                lastPos[n] = nullable[r] ? union(lastPos[l], lastPos[r]) : new IntRBTreeSet(lastPos[r]);
            }
            case STAR, QUESTION, PLUS -> {
                nullable[n] = type != NodeType.PLUS || nullable[l];
                firstPos[n] = new IntRBTreeSet(firstPos[l]);
                lastPos[n] = new IntRBTreeSet(lastPos[l]);
            }
            default -> throw new RuleCompilationException(RuleErrorCode.INTERNAL_ERROR,
                    "Unexpected node in flattened tree: " + node);
        }
    }

    private void calcFollowPos(int n) {
        if (n == RuleNode.NONE) {
            return;
        }
        RuleNode node = arena.get(n);
        if (node.type().isPosition()) {
            return;
        }
        calcFollowPos(node.left());
        calcFollowPos(node.right());
        switch (node.type()) {
            case CAT -> {
                for (int i : lastPos[node.left()]) {
                    followPos[i].addAll(firstPos[node.right()]);
                }
            }
            case STAR, PLUS -> {
                for (int i : lastPos[n]) {
                    followPos[i].addAll(firstPos[n]);
                }
            }
            default -> {
            }
        }
    }

    /**
     * Lets a match continue into a following rule when the character that
     * ends one rule can also start another chain-in rule.
     */
    private void calcChainedFollowPos() {
        IntList leafNodes = findNodes(tree, NodeType.LEAF_CHAR);
        IntList ruleRoots = new IntArrayList();
        addRuleRootNodes(ruleRoots, userRoot);

        IntSortedSet matchStartNodes = new IntRBTreeSet();
        for (int root : ruleRoots) {
            if (arena.get(root).isChainIn()) {
                matchStartNodes.addAll(firstPos[root]);
            }
        }

        boolean noChainMarks = rules.options().lbcmNoChain();
        for (int endNode : leafNodes) {
            if (!followPos[endNode].contains(endMarkNode)) {
                continue;
            }
            int endCategory = arena.get(endNode).val();
            if (noChainMarks && isCombiningMark(categories.getFirstChar(endCategory))) {
                continue;
            }
            for (int startNode : matchStartNodes) {
                RuleNode start = arena.get(startNode);
                if (start.type() == NodeType.LEAF_CHAR && start.val() == endCategory) {
                    followPos[endNode].addAll(followPos[startNode]);
                }
            }
        }
    }

    private static boolean isCombiningMark(int c) {
        return c >= 0
                && UCharacter.getIntPropertyValue(c, UProperty.LINE_BREAK) == UCharacter.LineBreak.COMBINING_MARK;
    }

    private void addRuleRootNodes(IntList dest, int n) {
        if (n == RuleNode.NONE) {
            return;
        }
        RuleNode node = arena.get(n);
        if (node.isRuleRoot()) {
            dest.add(n);
            return;
        }
        addRuleRootNodes(dest, node.left());
        addRuleRootNodes(dest, node.right());
    }

    // {bof} positions at the start of a rule become reachable directly from
    // the initial {bof} leaf.
    private void bofFixup() {
        int bofCategory = arena.get(bofNode).val();
        for (int p : firstPos[userRoot]) {
            RuleNode node = arena.get(p);
            if (node.type() == NodeType.LEAF_CHAR && node.val() == bofCategory) {
                followPos[bofNode].addAll(followPos[p]);
            }
        }
    }

    private void buildStateTable() {
        int numCategories = numCategories();
        Object2IntOpenHashMap<IntArrayList> known = new Object2IntOpenHashMap<>();
        known.defaultReturnValue(-1);

        StateDescriptor failState = new StateDescriptor(numCategories, new IntRBTreeSet());
        failState.marked = true;
        states.add(failState);
        known.put(new IntArrayList(), 0);

        StateDescriptor initial = new StateDescriptor(numCategories, new IntRBTreeSet(firstPos[tree]));
        states.add(initial);
        known.put(new IntArrayList(initial.positions), 1);

        for (int t = 1; t < states.size(); t++) {
            StateDescriptor state = states.get(t);
            state.marked = true;
            for (int category = 1; category < numCategories; category++) {
                IntSortedSet target = null;
                for (int p : state.positions) {
                    RuleNode node = arena.get(p);
                    if (node.type() == NodeType.LEAF_CHAR && node.val() == category) {
                        if (target == null) {
                            target = new IntRBTreeSet();
                        }
                        target.addAll(followPos[p]);
                    }
                }
                if (target == null) {
                    continue;
                }
                IntArrayList key = new IntArrayList(target);
                int index = known.getInt(key);
                if (index < 0) {
                    if (states.size() >= maxStates) {
                        throw new RuleCompilationException(RuleErrorCode.INTERNAL_ERROR,
                                "Forward table exceeds " + maxStates + " states");
                    }
                    index = states.size();
                    states.add(new StateDescriptor(numCategories, target));
                    known.put(key, index);
                }
                state.dtran.set(category, index);
            }
        }
    }

    private void flagAcceptingStates() {
        for (int marker : findNodes(tree, NodeType.END_MARK)) {
            RuleNode endMarker = arena.get(marker);
            for (StateDescriptor state : states) {
                if (!state.positions.contains(marker)) {
                    continue;
                }
                if (state.accepting == 0) {
                    state.accepting = endMarker.val() == 0 ? -1 : endMarker.val();
                }
                if (state.accepting == -1 && endMarker.val() != 0) {
                    // Look-ahead wins over a plain match in the same state.
                    state.accepting = endMarker.val();
                }
                if (endMarker.isLookAheadEnd()) {
                    state.lookAhead = state.accepting;
                }
            }
        }
    }

    private void flagLookAheadStates() {
        for (int marker : findNodes(tree, NodeType.LOOK_AHEAD)) {
            int ruleNumber = arena.get(marker).val();
            for (StateDescriptor state : states) {
                if (state.positions.contains(marker)) {
                    state.lookAhead = ruleNumber;
                }
            }
        }
    }

    private void flagTaggedStates() {
        for (int tag : findNodes(tree, NodeType.TAG)) {
            int value = arena.get(tag).val();
            for (StateDescriptor state : states) {
                if (state.positions.contains(tag)) {
                    state.tagValues.add(value);
                }
            }
        }
        IntList statusValues = rules.statusValues();
        for (StateDescriptor state : states) {
            if (!state.tagValues.isEmpty()) {
                state.tagIndex = statusValues.indexOf(state.tagValues.lastInt());
            }
        }
    }

    private IntList findNodes(int root, NodeType type) {
        IntList result = new IntArrayList();
        collect(root, type, result);
        return result;
    }

    private void collect(int n, NodeType type, IntList result) {
        if (n == RuleNode.NONE) {
            return;
        }
        RuleNode node = arena.get(n);
        if (node.type() == type) {
            result.add(n);
        }
        collect(node.left(), type, result);
        collect(node.right(), type, result);
    }

    // ---------------------------------------------------------------------
    // Minimization primitives
    // ---------------------------------------------------------------------

    /**
     * Searches for two categories whose columns are identical in every state,
     * starting at {@code categories.first()}. On success the pair holds the two
     * columns, the lower first.
     */
    public boolean findDuplCharClassFrom(IntPair pair) {
        int numStates = states.size();
        int numCols = numCategories();
        for (int first = pair.first(); first < numCols - 1; first++) {
            for (int second = first + 1; second < numCols; second++) {
                if (columnsEqual(first, second, numStates)) {
                    pair.set(first, second);
                    return true;
                }
            }
        }
        pair.set(Math.max(pair.first(), numCols - 1), 0);
        return false;
    }

    private boolean columnsEqual(int first, int second, int numStates) {
        if (numStates == 0) {
            return false;
        }
        for (StateDescriptor state : states) {
            if (state.next(first) != state.next(second)) {
                return false;
            }
        }
        return true;
    }

    public void removeColumn(int column) {
        for (StateDescriptor state : states) {
            state.dtran.removeInt(column);
        }
    }

    /**
     * Merges states that are equivalent, one pair at a time, until none remain.
     *
     * @return number of states removed
     */
    public int removeDuplicateStates() {
        IntPair pair = new IntPair(1, 0);
        int removed = 0;
        while (findDuplicateState(pair)) {
            removeState(pair);
            removed++;
        }
        return removed;
    }

    boolean findDuplicateState(IntPair pair) {
        int numStates = states.size();
        int numCols = numCategories();
        for (int first = pair.first(); first < numStates - 1; first++) {
            StateDescriptor firstState = states.get(first);
            for (int second = first + 1; second < numStates; second++) {
                StateDescriptor duplState = states.get(second);
                if (firstState.accepting != duplState.accepting
                        || firstState.lookAhead != duplState.lookAhead
                        || firstState.tagIndex != duplState.tagIndex) {
                    continue;
                }
                if (rowsMatch(firstState.dtran, duplState.dtran, numCols, first, second)) {
                    pair.set(first, second);
                    return true;
                }
            }
        }
        return false;
    }

    // Transitions back into either state of the pair count as equal.
    private static boolean rowsMatch(IntList firstRow, IntList duplRow, int numCols, int first, int second) {
        for (int col = 0; col < numCols; col++) {
            int firstVal = firstRow.getInt(col);
            int duplVal = duplRow.getInt(col);
            boolean same = firstVal == duplVal
                    || ((firstVal == first || firstVal == second) && (duplVal == first || duplVal == second));
            if (!same) {
                return false;
            }
        }
        return true;
    }

    private void removeState(IntPair pair) {
        states.remove(pair.second());
        for (StateDescriptor state : states) {
            remapTransitions(state.dtran, pair.first(), pair.second());
        }
    }

    private static void remapTransitions(IntList row, int keep, int dupl) {
        for (int col = 0; col < row.size(); col++) {
            int existing = row.getInt(col);
            if (existing == dupl) {
                row.set(col, keep);
            } else if (existing > dupl) {
                row.set(col, existing - 1);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Safe reverse table
    // ---------------------------------------------------------------------

    /**
     * Builds the safe reverse table from the final forward table.
     *
     * <p>A pair of categories (c1, c2) is safe when the forward table reaches
     * the same state after c1 c2 from every start state. Running backwards,
     * the safe table stops as soon as it has seen such a pair.
     */
    public void buildSafeReverseTable() {
        int numCategories = numCategories();
        int numStates = states.size();
        IntList safePairs = new IntArrayList();
        for (int c1 = 0; c1 < numCategories; c1++) {
            for (int c2 = 0; c2 < numCategories; c2++) {
                int wantedEndState = -1;
                boolean safe = true;
                for (int startState = 1; startState < numStates; startState++) {
                    int s2 = states.get(startState).next(c1);
                    int endState = states.get(s2).next(c2);
                    if (wantedEndState < 0) {
                        wantedEndState = endState;
                    } else if (wantedEndState != endState) {
                        safe = false;
                        break;
                    }
                }
                if (safe) {
                    safePairs.add(c1);
                    safePairs.add(c2);
                }
            }
        }

        safeTable.clear();
        IntArrayList startRow = new IntArrayList(numCategories);
        for (int c = 0; c < numCategories; c++) {
            startRow.add(c + 2);
        }
        IntArrayList stopRow = new IntArrayList(numCategories);
        stopRow.size(numCategories);
        safeTable.add(stopRow);
        safeTable.add(startRow);
        for (int row = 2; row < numCategories + 2; row++) {
            safeTable.add(new IntArrayList(startRow));
        }
        for (int i = 0; i < safePairs.size(); i += 2) {
            int c1 = safePairs.getInt(i);
            int c2 = safePairs.getInt(i + 1);
            safeTable.get(c2 + 2).set(c1, 0);
        }

        IntPair pair = new IntPair(1, 0);
        while (findDuplicateSafeState(pair)) {
            safeTable.remove(pair.second());
            for (IntArrayList row : safeTable) {
                remapTransitions(row, pair.first(), pair.second());
            }
        }
        logger.fine(() -> String.format("Safe table: %d safe pairs, %d states",
                safePairs.size() / 2, safeTable.size()));
    }

    private boolean findDuplicateSafeState(IntPair pair) {
        int numStates = safeTable.size();
        for (int first = pair.first(); first < numStates - 1; first++) {
            IntArrayList firstRow = safeTable.get(first);
            for (int second = first + 1; second < numStates; second++) {
                if (rowsMatch(firstRow, safeTable.get(second), firstRow.size(), first, second)) {
                    pair.set(first, second);
                    return true;
                }
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Export
    // ---------------------------------------------------------------------

    public int getTableSize() {
        return Math.toIntExact(RuleDataFormat.stateTableSize(states.size(), numCategories()));
    }

    public int getSafeTableSize() {
        return Math.toIntExact(RuleDataFormat.stateTableSize(safeTable.size(), numCategories()));
    }

    /**
     * Writes the forward table at {@code dest}'s position, in the buffer's byte order.
     */
    public void exportTable(ByteBuffer dest) {
        int flags = 0;
        if (rules.options().lookAheadHardBreak()) {
            flags |= RuleDataFormat.FLAG_LOOKAHEAD_HARD_BREAK;
        }
        if (categories.sawBOF()) {
            flags |= RuleDataFormat.FLAG_BOF_REQUIRED;
        }
        int numCategories = numCategories();
        writeTableHeader(dest, states.size(), numCategories, flags);
        for (StateDescriptor state : states) {
            dest.putShort(toInt16(state.accepting, "accepting"));
            dest.putShort(toInt16(state.lookAhead, "lookAhead"));
            dest.putShort(toInt16(state.tagIndex, "tagIndex"));
            dest.putShort((short) 0);
            writeTransitions(dest, state.dtran, numCategories);
        }
    }

    /**
     * Writes the safe reverse table at {@code dest}'s position, in the buffer's byte order.
     */
    public void exportSafeTable(ByteBuffer dest) {
        int numCategories = numCategories();
        writeTableHeader(dest, safeTable.size(), numCategories, 0);
        for (IntArrayList row : safeTable) {
            dest.putLong(0L);
            writeTransitions(dest, row, numCategories);
        }
    }

    private static void writeTableHeader(ByteBuffer dest, int numStates, int numCategories, int flags) {
        dest.putInt(numStates);
        dest.putInt(RuleDataFormat.rowLength(numCategories));
        dest.putInt(flags);
        dest.putInt(0);
    }

    private static void writeTransitions(ByteBuffer dest, IntList row, int numCategories) {
        for (int col = 0; col < numCategories; col++) {
            int next = row.getInt(col);
            if (next < 0 || next > RuleDataFormat.MAX_STATES) {
                throw new RuleCompilationException(RuleErrorCode.INTERNAL_ERROR,
                        "Next state out of range: " + next);
            }
            dest.putShort((short) next);
        }
    }

    private static short toInt16(int value, String field) {
        if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
            throw new RuleCompilationException(RuleErrorCode.INTERNAL_ERROR,
                    field + " value does not fit in 16 bits: " + value);
        }
        return (short) value;
    }

    // ---------------------------------------------------------------------
    // Accessors and dumps
    // ---------------------------------------------------------------------

    public int numCategories() {
        return categories.getNumCharCategories();
    }

    public int stateCount() {
        return states.size();
    }

    public int safeStateCount() {
        return safeTable.size();
    }

    public int transition(int state, int category) {
        return states.get(state).next(category);
    }

    public int accepting(int state) {
        return states.get(state).accepting;
    }

    public int lookAhead(int state) {
        return states.get(state).lookAhead;
    }

    public int tagIndex(int state) {
        return states.get(state).tagIndex;
    }

    public int safeTransition(int row, int category) {
        return safeTable.get(row).getInt(category);
    }

    public String describeStates() {
        int numCategories = numCategories();
        StringBuilder sb = new StringBuilder("Forward state table\n");
        sb.append("state |  Acc   LA  Tag |");
        for (int c = 0; c < numCategories; c++) {
            sb.append(String.format("%4d", c));
        }
        sb.append('\n');
        for (int s = 0; s < states.size(); s++) {
            StateDescriptor state = states.get(s);
            sb.append(String.format("%5d | %4d %4d %4d |", s, state.accepting, state.lookAhead, state.tagIndex));
            for (int c = 0; c < numCategories; c++) {
                sb.append(String.format("%4d", state.next(c)));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String describeSafeTable() {
        StringBuilder sb = new StringBuilder("Safe reverse table\n");
        for (int s = 0; s < safeTable.size(); s++) {
            sb.append(String.format("%5d |", s));
            for (int next : safeTable.get(s)) {
                sb.append(String.format("%4d", next));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String describeStatusTable() {
        StringBuilder sb = new StringBuilder("Rule status table\n");
        IntList values = rules.statusValues();
        for (int i = 0; i < values.size(); i++) {
            sb.append(String.format("%5d  %d%n", i, values.getInt(i)));
        }
        return sb.toString();
    }

    private static IntSortedSet singleton(int value) {
        IntSortedSet set = new IntRBTreeSet();
        set.add(value);
        return set;
    }

    private static IntSortedSet union(IntSortedSet a, IntSortedSet b) {
        IntSortedSet set = new IntRBTreeSet(a);
        set.addAll(b);
        return set;
    }
}

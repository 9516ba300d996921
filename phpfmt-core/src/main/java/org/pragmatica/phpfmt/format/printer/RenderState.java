package org.pragmatica.phpfmt.format.printer;

import org.pragmatica.phpfmt.format.StateInvariantException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Mutable traversal state of one renderer, consulted when classifying string literals.
 * Reset at the start of every top-level render; not thread-safe and not re-entrant.
 */
public final class RenderState {
    private final boolean annotating;
    private final Deque<CallSite> callStack = new ArrayDeque<>();

    private boolean firstArgument;
    private boolean inArrayValue;
    private boolean inArrayKey;
    private Optional<String> arrayKey = Optional.empty();
    private boolean inLiteralText;
    private Optional<String> lastLiteral = Optional.empty();
    private boolean rendering;

    public RenderState(boolean annotating) {
        this.annotating = annotating;
    }

    // ===== Render pass =====

    /**
     * Starts a top-level render with fresh state.
     *
     * @throws StateInvariantException if a render is already in progress
     */
    public Scope beginPass() {
        if (rendering) {
            throw new StateInvariantException("Renderer is already rendering");
        }
        callStack.clear();
        firstArgument = false;
        inArrayValue = false;
        inArrayKey = false;
        arrayKey = Optional.empty();
        inLiteralText = false;
        lastLiteral = Optional.empty();
        rendering = true;
        return () -> rendering = false;
    }

    public boolean annotating() {
        return annotating;
    }

    // ===== Calls =====

    /**
     * Enters the argument list of a call. The array context of an enclosing entry stays in force for
     * the arguments.
     */
    public Scope enterCall(CallSite site) {
        callStack.push(site);
        firstArgument = true;
        return this::popCall;
    }

    public void popCall() {
        if (callStack.isEmpty()) {
            throw new StateInvariantException("Pop from empty call stack");
        }
        callStack.pop();
    }

    public Optional<CallSite> innermostCall() {
        return Optional.ofNullable(callStack.peek());
    }

    public int callDepth() {
        return callStack.size();
    }

    public boolean firstArgument() {
        return firstArgument;
    }

    public void argumentRendered() {
        firstArgument = false;
    }

    // ===== Arrays =====

    /**
     * Enters the value of an array entry whose key, if it rendered as a literal, is {@code key}.
     */
    public Scope enterArrayValue(Optional<String> key) {
        var savedInArray = inArrayValue;
        var savedInKey = inArrayKey;
        var savedKey = arrayKey;
        inArrayValue = true;
        inArrayKey = false;
        arrayKey = key;
        return () -> {
            inArrayValue = savedInArray;
            inArrayKey = savedInKey;
            arrayKey = savedKey;
        };
    }

    /**
     * Enters the key of an array entry. Keys are never classified, whatever entry they are nested in.
     */
    public Scope enterArrayKey() {
        var savedInArray = inArrayValue;
        var savedInKey = inArrayKey;
        var savedKey = arrayKey;
        inArrayValue = false;
        inArrayKey = true;
        arrayKey = Optional.empty();
        return () -> {
            inArrayValue = savedInArray;
            inArrayKey = savedInKey;
            arrayKey = savedKey;
        };
    }

    public boolean inArrayKey() {
        return inArrayKey;
    }

    public boolean inArrayValue() {
        return inArrayValue;
    }

    public Optional<String> arrayKey() {
        return arrayKey;
    }

    // ===== Literals =====

    public Scope enterLiteralText() {
        var saved = inLiteralText;
        inLiteralText = true;
        return () -> inLiteralText = saved;
    }

    public boolean inLiteralText() {
        return inLiteralText;
    }

    public void clearLastLiteral() {
        lastLiteral = Optional.empty();
    }

    public void literalRendered(String value) {
        lastLiteral = Optional.of(value);
    }

    public Optional<String> lastLiteral() {
        return lastLiteral;
    }
}

package org.deduction.verifier;

import org.deduction.core.Formula;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 显式的作用域栈。嵌套再深也不依赖宿主语言的调用栈。
 */
public final class ScopeStack {

    private final Deque<ScopeFrame> frames = new ArrayDeque<>();

    public void push(ScopeFrame frame) {
        frames.push(frame);
    }

    public ScopeFrame pop() {
        if (frames.size() <= 1) {
            throw new IllegalStateException("ScopeStack: the root frame cannot be popped");
        }
        return frames.pop();
    }

    public ScopeFrame peek() {
        return frames.peek();
    }

    public int size() {
        return frames.size();
    }

    public boolean contains(int scopeId) {
        return find(scopeId) != null;
    }

    public ScopeFrame find(int scopeId) {
        for (ScopeFrame frame : frames) {
            if (frame.getId() == scopeId) {
                return frame;
            }
        }
        return null;
    }

    /**
     * 由外到内列出各层仍然有效的假设。
     */
    public List<Formula> openAssumptions() {
        List<Formula> result = new ArrayList<>();
        Iterator<ScopeFrame> it = frames.descendingIterator();
        while (it.hasNext()) {
            ScopeFrame frame = it.next();
            if (frame.getAssumption() != null) {
                result.add(frame.getAssumption());
            }
        }
        return result;
    }

    /**
     * 由外到内列出尚未关闭的 Show 目标。
     */
    public List<Formula> openGoals() {
        List<Formula> result = new ArrayList<>();
        Iterator<ScopeFrame> it = frames.descendingIterator();
        while (it.hasNext()) {
            ScopeFrame frame = it.next();
            if (frame.getGoal() != null) {
                result.add(frame.getGoal());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "ScopeStack" + frames;
    }
}

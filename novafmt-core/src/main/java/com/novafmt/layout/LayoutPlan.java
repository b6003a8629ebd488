package com.novafmt.layout;

import com.novafmt.doc.Break;
import com.novafmt.doc.Group;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 断行方案：哪些组展开、哪些断点换行及换行后的缩进。未记录的节点均为平铺。
 */
public final class LayoutPlan {
    private final Set<Group> brokenGroups = Collections.newSetFromMap(new IdentityHashMap<Group, Boolean>());
    private final Map<Break, Integer> newlines = new IdentityHashMap<>();

    void markBroken(Group group) {
        brokenGroups.add(group);
    }

    void markNewline(Break b, int indent) {
        newlines.put(b, indent);
    }

    public boolean isBroken(Group group) {
        return brokenGroups.contains(group);
    }

    public boolean isNewline(Break b) {
        return newlines.containsKey(b);
    }

    /** 换行后的缩进；平铺的断点返回 -1 */
    public int indentOf(Break b) {
        Integer indent = newlines.get(b);
        return indent != null ? indent : -1;
    }

    public int brokenGroupCount() {
        return brokenGroups.size();
    }
}

package com.graphsync.node;

import com.graphsync.exception.ConstructionException;

/**
 * Where the records of a {@link RecordNode} live: directly in a group, or under the records of a parent node,
 * inheriting its group.
 */
public interface RecordPlacement {

    GroupNode group();

    static RecordPlacement inGroup(GroupNode group) {
        return new InGroup(group);
    }

    static RecordPlacement underParent(RecordNode parent) {
        return new UnderParent(parent);
    }

    record InGroup(GroupNode group) implements RecordPlacement {
        public InGroup {
            if (group == null) {
                throw new ConstructionException("InGroup placement needs a group");
            }
        }
    }

    record UnderParent(RecordNode parent) implements RecordPlacement {
        public UnderParent {
            if (parent == null) {
                throw new ConstructionException("UnderParent placement needs a parent record node");
            }
        }

        @Override
        public GroupNode group() {
            return parent.getGroup();
        }
    }
}

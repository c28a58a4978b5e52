package im.arun.docoutline.tree;

import im.arun.docoutline.model.OutlineItem;
import lombok.Value;

import java.util.List;

@Value
public class HierarchyResult {
    List<OutlineItem> items;
    List<HierarchyDecision> decisions;
}

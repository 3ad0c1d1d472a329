package com.gridmodel.glm.model;

/**
 * Visitor pattern interface for traversing parsed GLM items.
 */
public interface GlmItemVisitor {
    void visit(DirectiveItem directive);
    void visit(ClockItem clock);
    void visit(ModuleItem module);
    void visit(ObjectItem object);
    void visit(ScheduleItem schedule);
    void visit(EmbeddedConfigItem embedded);
    void visit(ClassDefItem classDef);
}

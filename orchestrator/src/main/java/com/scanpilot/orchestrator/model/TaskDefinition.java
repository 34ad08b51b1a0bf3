package com.scanpilot.orchestrator.model;

import jakarta.persistence.*;
import org.hibernate.annotations.Immutable;

import java.util.List;

/**
 * A submitted assessment task. Never mutated after it is accepted:
 * there are no setters and Hibernate treats the entity as read-only.
 *
 * Every ExecutionRecord references one of these by id.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Immutable
@Table(name = "tasks")
public class TaskDefinition {

    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    // Host, URL or network range handed to the tools.
    @Column(nullable = false)
    private String target;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AiProvider provider;

    @Column(nullable = false)
    private String model;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private List<String> tools;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private Strategy strategy;

    @Column(nullable = false)
    private int depth;

    @Convert(converter = StringListConverter.class)
    @Column(nullable = false, columnDefinition = "TEXT")
    private List<String> scope;

    @Convert(converter = StringListConverter.class)
    @Column(name = "exclude_rules", nullable = false, columnDefinition = "TEXT")
    private List<String> excludeRules;

    @Column(name = "user_id", nullable = false)
    private String userId;

    // 1 (low) .. 4 (urgent); higher runs first.
    @Column(nullable = false)
    private int priority;

    // Epoch millis; null means "as soon as a slot is free".
    @Column(name = "scheduled_at")
    private Long scheduledAt;

    // Whether findings are confirmed in the sandbox.
    @Column(nullable = false)
    private boolean verify;

    @Column(name = "created_at", nullable = false, updatable = false)
    private long createdAt;

    protected TaskDefinition() {}   // required by JPA

    public TaskDefinition(String id, String name, String target, ModelSelection modelSelection,
                          List<String> tools, Strategy strategy, int depth, List<String> scope,
                          List<String> excludeRules, String userId, int priority,
                          Long scheduledAt, boolean verify, long createdAt) {
        this.id           = id;
        this.name         = name;
        this.target       = target;
        this.provider     = modelSelection.provider();
        this.model        = modelSelection.model();
        this.tools        = List.copyOf(tools);
        this.strategy     = strategy;
        this.depth        = depth;
        this.scope        = List.copyOf(scope);
        this.excludeRules = List.copyOf(excludeRules);
        this.userId       = userId;
        this.priority     = priority;
        this.scheduledAt  = scheduledAt;
        this.verify       = verify;
        this.createdAt    = createdAt;
    }

    public String         getId()           { return id; }
    public String         getName()         { return name; }
    public String         getTarget()       { return target; }
    public ModelSelection getModelSelection() { return new ModelSelection(provider, model); }
    public List<String>   getTools()        { return tools; }
    public Strategy       getStrategy()     { return strategy; }
    public int            getDepth()        { return depth; }
    public List<String>   getScope()        { return scope; }
    public List<String>   getExcludeRules() { return excludeRules; }
    public String         getUserId()       { return userId; }
    public int            getPriority()     { return priority; }
    public Long           getScheduledAt()  { return scheduledAt; }
    public boolean        isVerify()        { return verify; }
    public long           getCreatedAt()    { return createdAt; }
}

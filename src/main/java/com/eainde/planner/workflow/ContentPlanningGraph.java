package com.eainde.planner.workflow;

import com.eainde.planner.calendar.CalendarAssembler;
import com.eainde.planner.content.WeeklyPostPlanner;
import com.eainde.planner.context.ArtifactKeys;
import com.eainde.planner.context.ContextStore;
import com.eainde.planner.hashtag.HashtagRecommender;
import com.eainde.planner.hashtag.HashtagRequest;
import com.eainde.planner.intake.IntakeStage;
import com.eainde.planner.model.BrandVisualGuidelines;
import com.eainde.planner.model.HashtagRecommendation;
import com.eainde.planner.model.PlanningRequest;
import com.eainde.planner.model.VisualConcept;
import com.eainde.planner.stage.StageNames;
import com.eainde.planner.stage.StageResult;
import com.eainde.planner.strategy.StrategyBuilder;
import com.eainde.planner.summary.SummaryAssembler;
import com.eainde.planner.visual.BrandVisualAnalyzer;
import com.eainde.planner.visual.VisualConceptGenerator;
import com.eainde.planner.visual.VisualConceptRequest;
import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * The planning pipeline as a graph:
 * <pre>
 * START → intake → strategy → daily_posts → calendar → hashtags → visuals → summary → END
 * </pre>
 * Every node routes to END as soon as its step fails.
 */
@Log4j2
@Component
public class ContentPlanningGraph {

    public static final String INTAKE = "intake";
    public static final String STRATEGY = "strategy";
    public static final String DAILY_POSTS = "daily_posts";
    public static final String CALENDAR = "calendar";
    public static final String HASHTAGS = "hashtags";
    public static final String VISUALS = "visuals";
    public static final String SUMMARY = "summary";

    private final IntakeStage intake;
    private final StrategyBuilder strategyBuilder;
    private final WeeklyPostPlanner weeklyPostPlanner;
    private final CalendarAssembler calendarAssembler;
    private final HashtagRecommender hashtagRecommender;
    private final BrandVisualAnalyzer brandVisualAnalyzer;
    private final VisualConceptGenerator visualConceptGenerator;
    private final SummaryAssembler summaryAssembler;
    private final StageRoutingEdge routingEdge;
    private final List<String> defaultBrandedTags;
    private final String defaultBrandColors;

    public ContentPlanningGraph(IntakeStage intake,
                                StrategyBuilder strategyBuilder,
                                WeeklyPostPlanner weeklyPostPlanner,
                                CalendarAssembler calendarAssembler,
                                HashtagRecommender hashtagRecommender,
                                BrandVisualAnalyzer brandVisualAnalyzer,
                                VisualConceptGenerator visualConceptGenerator,
                                SummaryAssembler summaryAssembler,
                                StageRoutingEdge routingEdge,
                                @Value("${planner.default-branded-hashtags:}") String defaultBrandedTags,
                                @Value("${planner.default-brand-colors:}") String defaultBrandColors) {
        this.intake = intake;
        this.strategyBuilder = strategyBuilder;
        this.weeklyPostPlanner = weeklyPostPlanner;
        this.calendarAssembler = calendarAssembler;
        this.hashtagRecommender = hashtagRecommender;
        this.brandVisualAnalyzer = brandVisualAnalyzer;
        this.visualConceptGenerator = visualConceptGenerator;
        this.summaryAssembler = summaryAssembler;
        this.routingEdge = routingEdge;
        this.defaultBrandedTags = Arrays.stream(defaultBrandedTags.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .toList();
        this.defaultBrandColors = defaultBrandColors;
    }

    @Bean("contentPlanningWorkflow")
    public CompiledGraph<PlanningState> build() throws GraphStateException {

        StateGraph<PlanningState> workflow = new StateGraph<>(PlanningState::new);

        workflow.addNode(INTAKE, new StageNode(StageNames.INTAKE,
                (store, state) -> intake.execute(store, state.getRequest())));
        workflow.addNode(STRATEGY, new StageNode(StageNames.STRATEGY_BUILDER,
                (store, state) -> strategyBuilder.execute(store)));
        workflow.addNode(DAILY_POSTS, new StageNode(StageNames.WEEKLY_POST_PLANNER,
                (store, state) -> weeklyPostPlanner.execute(store)));
        workflow.addNode(CALENDAR, new StageNode(StageNames.CALENDAR_ASSEMBLER,
                (store, state) -> calendarAssembler.execute(store)));
        workflow.addNode(HASHTAGS, new StageNode(StageNames.HASHTAG_RECOMMENDER,
                (store, state) -> recommendHashtags(store, state.getRequest())));
        workflow.addNode(VISUALS, new StageNode(StageNames.VISUAL_CONCEPT_GENERATOR,
                (store, state) -> designVisuals(store, state.getRequest())));
        workflow.addNode(SUMMARY, new StageNode(StageNames.SUMMARY_ASSEMBLER,
                (store, state) -> summaryAssembler.execute(store)));

        workflow.addEdge(START, INTAKE);
        route(workflow, INTAKE, STRATEGY);
        route(workflow, STRATEGY, DAILY_POSTS);
        route(workflow, DAILY_POSTS, CALENDAR);
        route(workflow, CALENDAR, HASHTAGS);
        route(workflow, HASHTAGS, VISUALS);
        route(workflow, VISUALS, SUMMARY);
        workflow.addEdge(SUMMARY, END);

        return workflow.compile();
    }

    private void route(StateGraph<PlanningState> workflow, String from, String to) throws GraphStateException {
        workflow.addConditionalEdges(
                from,
                routingEdge,
                Map.of(
                        StageRoutingEdge.NEXT, to,
                        StageRoutingEdge.HALT, END
                )
        );
    }

    /** One recommendation per calendar day; the first failing day fails the node. */
    StageResult<List<HashtagRecommendation>> recommendHashtags(ContextStore store, PlanningRequest request) {
        List<String> branded = request != null && !request.getBrandedHashtags().isEmpty()
                ? request.getBrandedHashtags()
                : defaultBrandedTags;

        List<HashtagRecommendation> recommendations = new ArrayList<>();
        for (int day = 1; day <= ArtifactKeys.DAYS_PER_WEEK; day++) {
            StageResult<HashtagRecommendation> result = hashtagRecommender.execute(store, new HashtagRequest(day, branded));
            if (!result.isSuccess()) {
                return result.propagate();
            }
            recommendations.add(result.data());
        }
        return StageResult.success(hashtagRecommender.name(),
                "Hashtags recommended for " + recommendations.size() + " days", recommendations);
    }

    /** Brand guidelines first, then one concept per calendar day; the first failure fails the node. */
    StageResult<List<VisualConcept>> designVisuals(ContextStore store, PlanningRequest request) {
        StageResult<BrandVisualGuidelines> guidelines = brandVisualAnalyzer.execute(store);
        if (!guidelines.isSuccess()) {
            return guidelines.propagate();
        }
        String colors = request != null && request.getBrandColors() != null && !request.getBrandColors().isBlank()
                ? request.getBrandColors()
                : defaultBrandColors;

        List<VisualConcept> concepts = new ArrayList<>();
        for (int day = 1; day <= ArtifactKeys.DAYS_PER_WEEK; day++) {
            StageResult<VisualConcept> result = visualConceptGenerator.execute(store, new VisualConceptRequest(day, colors));
            if (!result.isSuccess()) {
                return result.propagate();
            }
            concepts.add(result.data());
        }
        return StageResult.success(visualConceptGenerator.name(),
                "Visual concepts designed for " + concepts.size() + " days", concepts);
    }
}

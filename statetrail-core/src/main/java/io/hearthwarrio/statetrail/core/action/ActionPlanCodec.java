package io.hearthwarrio.statetrail.core.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes action plans in their JSON wire form.
 * <p>
 * Accepted inputs:
 * <ul>
 *   <li>a bare array of action records</li>
 *   <li>an object holding the array under {@code actions}, {@code plan} or {@code steps}</li>
 *   <li>free text (for example a model reply) containing one of the above in a fenced block
 *   or as the first bracketed array</li>
 * </ul>
 */
public final class ActionPlanCodec {

    private static final Logger log = LoggerFactory.getLogger(ActionPlanCodec.class);

    private static final List<String> PLAN_KEYS = List.of("actions", "plan", "steps");

    private static final List<Pattern> EMBEDDED_PLAN_PATTERNS = List.of(
            Pattern.compile("```json\\s*(\\{.*?\\}|\\[.*?\\])\\s*```", Pattern.DOTALL),
            Pattern.compile("```\\s*(\\{.*?\\}|\\[.*?\\])\\s*```", Pattern.DOTALL),
            Pattern.compile("(\\[.*\\])", Pattern.DOTALL)
    );

    private final ObjectMapper mapper;

    public ActionPlanCodec() {
        this(new ObjectMapper());
    }

    public ActionPlanCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /**
     * Decodes a plan.
     *
     * @param content plan text
     * @return ordered actions (unknown types are kept as {@link UnknownAction})
     * @throws ActionPlanException if no plan array can be found or a record is malformed
     */
    public List<Action> decode(String content) {
        if (content == null || content.isBlank()) {
            throw new ActionPlanException("Plan is empty");
        }

        Optional<ArrayNode> direct = tryReadPlanArray(content);
        if (direct.isPresent()) {
            return toActions(direct.get());
        }

        for (Pattern pattern : EMBEDDED_PLAN_PATTERNS) {
            Matcher m = pattern.matcher(content);
            if (m.find()) {
                Optional<ArrayNode> embedded = tryReadPlanArray(m.group(1));
                if (embedded.isPresent()) {
                    log.debug("Plan extracted from surrounding text with pattern {}", pattern.pattern());
                    return toActions(embedded.get());
                }
            }
        }

        log.warn("No action list found in plan text ({} chars)", content.length());
        throw new ActionPlanException("No action list found in plan");
    }

    /**
     * Decodes a single action record.
     *
     * @param node JSON object with a {@code type} field
     * @return action
     */
    public Action decodeAction(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ActionPlanException("Action record must be an object, got: " + node);
        }
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual() || typeNode.asText().isBlank()) {
            throw new ActionPlanException("Action record has no type: " + node);
        }
        String type = typeNode.asText();

        Optional<ActionKind> kind = ActionKind.fromWire(type);
        if (kind.isEmpty()) {
            return new UnknownAction(type);
        }

        switch (kind.get()) {
            case GOTO:
                return new GotoAction(text(node, "url"));
            case CLICK_BY_TEXT:
                return new ClickByTextAction(text(node, "text"));
            case WAIT_FOR_MODAL:
                return new WaitForModalAction();
            case FILL_INPUTS:
                return new FillInputsAction(inputs(node.get("inputs")));
            case CLICK_SUBMIT:
                return new ClickSubmitAction(texts(node.get("button_texts")));
            case CAPTURE_STATE:
                return new CaptureStateAction();
            default:
                return new UnknownAction(type);
        }
    }

    /**
     * Encodes actions as a pretty-printed JSON array.
     *
     * @param actions actions to write
     * @return JSON text
     */
    public String encode(List<? extends Action> actions) {
        Objects.requireNonNull(actions, "actions must not be null");
        ArrayNode array = mapper.createArrayNode();
        for (Action action : actions) {
            array.add(encodeAction(action));
        }
        try {
            return mapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(array);
        } catch (JsonProcessingException e) {
            throw new ActionPlanException("Cannot encode plan", e);
        }
    }

    private ObjectNode encodeAction(Action action) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", action.type());
        if (action instanceof GotoAction g) {
            node.put("url", g.getUrl());
        } else if (action instanceof ClickByTextAction c) {
            node.put("text", c.getText());
        } else if (action instanceof FillInputsAction f) {
            ObjectNode inputs = node.putObject("inputs");
            f.getInputs().forEach(inputs::put);
        } else if (action instanceof ClickSubmitAction s && !s.getCandidateTexts().isEmpty()) {
            ArrayNode texts = node.putArray("button_texts");
            s.getCandidateTexts().forEach(texts::add);
        }
        return node;
    }

    private Optional<ArrayNode> tryReadPlanArray(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
        if (root == null) {
            return Optional.empty();
        }
        if (root.isArray()) {
            return Optional.of((ArrayNode) root);
        }
        if (root.isObject()) {
            for (String key : PLAN_KEYS) {
                JsonNode candidate = root.get(key);
                if (candidate != null && candidate.isArray()) {
                    return Optional.of((ArrayNode) candidate);
                }
            }
        }
        return Optional.empty();
    }

    private List<Action> toActions(ArrayNode array) {
        List<Action> out = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            out.add(decodeAction(node));
        }
        return out;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return "";
        }
        return v.asText();
    }

    private static Map<String, String> inputs(JsonNode node) {
        Map<String, String> out = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return out;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            out.put(e.getKey(), e.getValue().isNull() ? "" : e.getValue().asText());
        }
        return out;
    }

    private static List<String> texts(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return out;
        }
        for (JsonNode t : node) {
            out.add(t.asText());
        }
        return out;
    }
}

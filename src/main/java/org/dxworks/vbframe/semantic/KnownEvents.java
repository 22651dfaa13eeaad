package org.dxworks.vbframe.semantic;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Event names of the intrinsic VB6 forms and controls. Types outside this table (ActiveX controls from
 * referenced {@code .ocx} files) are unknown: their events cannot be verified.
 */
public final class KnownEvents {

    private static final Set<String> MOUSE = Set.of("Click", "DblClick", "MouseDown", "MouseMove", "MouseUp");
    private static final Set<String> KEYS = Set.of("KeyDown", "KeyPress", "KeyUp");
    private static final Set<String> FOCUS = Set.of("GotFocus", "LostFocus", "Validate");
    private static final Set<String> DRAG = Set.of("DragDrop", "DragOver", "OLEDragDrop", "OLEDragOver",
            "OLEStartDrag", "OLECompleteDrag", "OLEGiveFeedback", "OLESetData");
    private static final Set<String> LINK = Set.of("LinkClose", "LinkError", "LinkNotify", "LinkOpen");

    private static final Map<String, Set<String>> EVENTS = new HashMap<>();

    static {
        register("Form", MOUSE, KEYS, DRAG, LINK, Set.of("Activate", "Deactivate", "GotFocus", "LostFocus",
                "Initialize", "Load", "Paint", "QueryUnload", "Resize", "Terminate", "Unload", "LinkExecute"));
        register("MDIForm", MOUSE, DRAG, LINK, Set.of("Activate", "Deactivate", "Initialize", "Load",
                "QueryUnload", "Resize", "Terminate", "Unload", "LinkExecute"));
        register("CommandButton", MOUSE, KEYS, FOCUS, DRAG);
        register("TextBox", MOUSE, KEYS, FOCUS, DRAG, LINK, Set.of("Change"));
        register("Label", MOUSE, DRAG, LINK, Set.of("Change"));
        register("CheckBox", MOUSE, KEYS, FOCUS, DRAG);
        register("OptionButton", MOUSE, KEYS, FOCUS, DRAG);
        register("ComboBox", MOUSE, KEYS, FOCUS, DRAG, Set.of("Change", "DropDown", "Scroll"));
        register("ListBox", MOUSE, KEYS, FOCUS, DRAG, Set.of("ItemCheck", "Scroll"));
        register("Frame", MOUSE, DRAG);
        register("PictureBox", MOUSE, KEYS, FOCUS, DRAG, LINK, Set.of("Change", "Paint", "Resize"));
        register("Image", MOUSE, DRAG);
        register("Timer", Set.of("Timer"));
        register("HScrollBar", KEYS, FOCUS, DRAG, Set.of("Change", "Scroll"));
        register("VScrollBar", KEYS, FOCUS, DRAG, Set.of("Change", "Scroll"));
        register("DriveListBox", KEYS, FOCUS, DRAG, Set.of("Change", "Scroll"));
        register("DirListBox", MOUSE, KEYS, FOCUS, DRAG, Set.of("Change", "Scroll"));
        register("FileListBox", MOUSE, KEYS, FOCUS, DRAG, Set.of("PathChange", "PatternChange", "Scroll"));
        register("Shape");
        register("Line");
        register("Menu", Set.of("Click"));
        register("Data", MOUSE, DRAG, Set.of("Error", "Reposition", "Resize", "Validate"));
        register("OLE", MOUSE, KEYS, FOCUS, DRAG, Set.of("ObjectMove", "Resize", "Updated"));
    }

    private KnownEvents() {
        // lookup table
    }

    @SafeVarargs
    private static void register(String type, Set<String>... groups) {
        Set<String> events = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (Set<String> group : groups) {
            events.addAll(group);
        }
        EVENTS.put(key(type), events);
    }

    /**
     * True for the intrinsic control and form types, with or without the {@code VB.} prefix.
     */
    public static boolean isKnownType(String controlType) {
        return controlType != null && EVENTS.containsKey(key(controlType));
    }

    public static boolean supports(String controlType, String eventName) {
        Set<String> events = controlType == null ? null : EVENTS.get(key(controlType));
        return events != null && events.contains(eventName);
    }

    private static String key(String type) {
        String lower = type.toLowerCase(Locale.ROOT);
        return lower.startsWith("vb.") ? lower.substring(3) : lower;
    }
}

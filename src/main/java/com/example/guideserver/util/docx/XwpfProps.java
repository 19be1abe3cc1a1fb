package com.example.guideserver.util.docx;

import com.example.guideserver.model.docx.BorderSide;
import com.example.guideserver.model.docx.DocxBorder;
import com.example.guideserver.model.docx.VMergeState;
import lombok.extern.slf4j.Slf4j;
import org.apache.xmlbeans.XmlAnySimpleType;
import org.apache.xmlbeans.impl.values.XmlValueOutOfRangeException;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTBorder;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSpacing;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblBorders;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblCellMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTblWidth;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcBorders;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcMar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTcPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTVMerge;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STMerge;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 属性查询层：从 POI 的 CT 属性对象（tcPr / tblPr / pPr / rPr）取值
 *
 * 入参允许为 null；缺失的属性返回 Optional.empty() 或空 Map。
 * 属性值不合法（如 w:val="abc" 的 gridSpan）按缺失处理。
 * 边框和边距只读 top/bottom/left/right（表格级另有 insideH/insideV）。
 */
@Slf4j
public final class XwpfProps {

    private XwpfProps() {
    }

    // ==================== 单元格 tcPr ====================

    public static Optional<String> gridSpan(CTTcPr pr) {
        if (pr == null || !pr.isSetGridSpan()) {
            return Optional.empty();
        }
        return read("gridSpan", () -> pr.getGridSpan().getVal()).map(Object::toString);
    }

    /**
     * &lt;w:vMerge/&gt; 没有 val 时等同 continue
     */
    public static VMergeState vMerge(CTTcPr pr) {
        if (pr == null || !pr.isSetVMerge()) {
            return VMergeState.NONE;
        }
        CTVMerge vm = pr.getVMerge();
        if (vm == null || !vm.isSetVal()) {
            return VMergeState.CONTINUE;
        }
        Optional<STMerge.Enum> val = read("vMerge", vm::getVal);
        if (val.isPresent() && STMerge.RESTART.equals(val.get())) {
            return VMergeState.RESTART;
        }
        return VMergeState.CONTINUE;
    }

    public static Optional<String> fill(CTTcPr pr) {
        if (pr == null || !pr.isSetShd() || !pr.getShd().isSetFill()) {
            return Optional.empty();
        }
        return text(pr.getShd().xgetFill());
    }

    public static Optional<String> verticalAlign(CTTcPr pr) {
        if (pr == null || !pr.isSetVAlign()) {
            return Optional.empty();
        }
        return read("vAlign", () -> pr.getVAlign().getVal()).map(Object::toString);
    }

    public static Map<BorderSide, DocxBorder> cellBorders(CTTcPr pr) {
        Map<BorderSide, DocxBorder> out = new EnumMap<>(BorderSide.class);
        if (pr == null || !pr.isSetTcBorders()) {
            return out;
        }
        CTTcBorders b = pr.getTcBorders();
        putBorder(out, BorderSide.TOP, b.getTop());
        putBorder(out, BorderSide.BOTTOM, b.getBottom());
        putBorder(out, BorderSide.LEFT, b.getLeft());
        putBorder(out, BorderSide.RIGHT, b.getRight());
        return out;
    }

    /**
     * tcMar 中各边 w:w 原值（twips）
     */
    public static Map<BorderSide, String> cellMargins(CTTcPr pr) {
        Map<BorderSide, String> out = new EnumMap<>(BorderSide.class);
        if (pr == null || !pr.isSetTcMar()) {
            return out;
        }
        CTTcMar m = pr.getTcMar();
        putWidth(out, BorderSide.TOP, m.getTop());
        putWidth(out, BorderSide.BOTTOM, m.getBottom());
        putWidth(out, BorderSide.LEFT, m.getLeft());
        putWidth(out, BorderSide.RIGHT, m.getRight());
        return out;
    }

    // ==================== 表格 tblPr ====================

    public static Map<BorderSide, DocxBorder> tableBorders(CTTblPr pr) {
        Map<BorderSide, DocxBorder> out = new EnumMap<>(BorderSide.class);
        if (pr == null || !pr.isSetTblBorders()) {
            return out;
        }
        CTTblBorders b = pr.getTblBorders();
        putBorder(out, BorderSide.TOP, b.getTop());
        putBorder(out, BorderSide.BOTTOM, b.getBottom());
        putBorder(out, BorderSide.LEFT, b.getLeft());
        putBorder(out, BorderSide.RIGHT, b.getRight());
        putBorder(out, BorderSide.INSIDE_H, b.getInsideH());
        putBorder(out, BorderSide.INSIDE_V, b.getInsideV());
        return out;
    }

    public static Map<BorderSide, String> tableCellMargins(CTTblPr pr) {
        Map<BorderSide, String> out = new EnumMap<>(BorderSide.class);
        if (pr == null || !pr.isSetTblCellMar()) {
            return out;
        }
        CTTblCellMar m = pr.getTblCellMar();
        putWidth(out, BorderSide.TOP, m.getTop());
        putWidth(out, BorderSide.BOTTOM, m.getBottom());
        putWidth(out, BorderSide.LEFT, m.getLeft());
        putWidth(out, BorderSide.RIGHT, m.getRight());
        return out;
    }

    // ==================== 段落 pPr ====================

    public static Optional<String> justification(CTPPr pr) {
        if (pr == null || !pr.isSetJc()) {
            return Optional.empty();
        }
        return read("jc", () -> pr.getJc().getVal()).map(Object::toString);
    }

    public static boolean isListItem(CTPPr pr) {
        return pr != null && pr.isSetNumPr();
    }

    /** 段前，单位 twips */
    public static Optional<Double> spacingBefore(CTPPr pr) {
        CTSpacing s = spacing(pr);
        return s != null && s.isSetBefore() ? number(text(s.xgetBefore())) : Optional.<Double>empty();
    }

    /** 段后，单位 twips */
    public static Optional<Double> spacingAfter(CTPPr pr) {
        CTSpacing s = spacing(pr);
        return s != null && s.isSetAfter() ? number(text(s.xgetAfter())) : Optional.<Double>empty();
    }

    /** 行距原值，auto 规则下单位为 1/240 行 */
    public static Optional<Double> spacingLine(CTPPr pr) {
        CTSpacing s = spacing(pr);
        return s != null && s.isSetLine() ? number(text(s.xgetLine())) : Optional.<Double>empty();
    }

    public static Optional<String> lineRule(CTPPr pr) {
        CTSpacing s = spacing(pr);
        if (s == null || !s.isSetLineRule()) {
            return Optional.empty();
        }
        return read("lineRule", s::getLineRule).map(Object::toString);
    }

    private static CTSpacing spacing(CTPPr pr) {
        return pr != null && pr.isSetSpacing() ? pr.getSpacing() : null;
    }

    // ==================== 字符 rPr ====================

    /** w:sz 原值，单位半磅 */
    public static Optional<Double> fontSize(CTRPr pr) {
        if (pr == null || pr.sizeOfSzArray() == 0) {
            return Optional.empty();
        }
        return number(text(pr.getSzArray(0).xgetVal()));
    }

    public static Optional<String> color(CTRPr pr) {
        if (pr == null || pr.sizeOfColorArray() == 0) {
            return Optional.empty();
        }
        return text(pr.getColorArray(0).xgetVal());
    }

    public static Optional<String> highlight(CTRPr pr) {
        if (pr == null || pr.sizeOfHighlightArray() == 0) {
            return Optional.empty();
        }
        return read("highlight", () -> pr.getHighlightArray(0).getVal()).map(Object::toString);
    }

    // ==================== 通用 ====================

    /**
     * 数值文本，无法解析时为空
     */
    public static Optional<Double> number(Optional<String> raw) {
        if (!raw.isPresent()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Double.parseDouble(raw.get().trim()));
        } catch (NumberFormatException e) {
            log.debug("忽略非数值属性: {}", raw.get());
            return Optional.empty();
        }
    }

    static DocxBorder border(CTBorder b) {
        String val = read("border", b::getVal).map(Object::toString).orElse(null);
        String size = b.isSetSz() ? read("sz", b::getSz).map(Object::toString).orElse(null) : null;
        String color = b.isSetColor() ? text(b.xgetColor()).orElse(null) : null;
        return new DocxBorder(val, size, color);
    }

    private static void putBorder(Map<BorderSide, DocxBorder> out, BorderSide side, CTBorder b) {
        if (b != null) {
            out.put(side, border(b));
        }
    }

    private static void putWidth(Map<BorderSide, String> out, BorderSide side, CTTblWidth w) {
        if (w != null && w.isSetW()) {
            Optional<String> value = text(w.xgetW());
            if (value.isPresent()) {
                out.put(side, value.get());
            }
        }
    }

    /**
     * 联合类型的原始文本；空串视为缺失
     */
    private static Optional<String> text(XmlAnySimpleType value) {
        if (value == null) {
            return Optional.empty();
        }
        String s = value.getStringValue();
        return s == null || s.isEmpty() ? Optional.<String>empty() : Optional.of(s);
    }

    private static <T> Optional<T> read(String name, Supplier<T> getter) {
        try {
            return Optional.ofNullable(getter.get());
        } catch (XmlValueOutOfRangeException e) {
            log.debug("属性 {} 取值不合法，按缺失处理: {}", name, e.getMessage());
            return Optional.empty();
        }
    }
}

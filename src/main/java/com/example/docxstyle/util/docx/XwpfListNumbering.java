package com.example.docxstyle.util.docx;

import com.example.docxstyle.util.style.ListType;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFAbstractNum;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.apache.xmlbeans.XmlBeans;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTLvl;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STNumberFormat;

import java.math.BigInteger;
import java.util.EnumMap;
import java.util.Map;

/**
 * 文档编号定义：按列表类型懒创建一个项目符号或十进制编号，供段落引用
 */
@Slf4j
public class XwpfListNumbering {

    private static final int LEVELS = 9;

    private final XWPFDocument document;
    private final Map<ListType, BigInteger> numIds = new EnumMap<>(ListType.class);

    public XwpfListNumbering(XWPFDocument document) {
        this.document = document;
    }

    /**
     * 获取（必要时创建）列表类型对应的 numId
     */
    public BigInteger numIdFor(ListType listType) {
        if (listType == null || listType == ListType.NONE) {
            throw new IllegalArgumentException("列表类型不能为 NONE");
        }
        BigInteger existing = numIds.get(listType);
        if (existing != null) {
            return existing;
        }

        XWPFNumbering numbering = document.createNumbering();

        // 1. 分配未被占用的 abstractNumId
        BigInteger abstractId = BigInteger.ZERO;
        while (numbering.getAbstractNum(abstractId) != null) {
            abstractId = abstractId.add(BigInteger.ONE);
        }

        // 2. 构建九级编号定义
        CTAbstractNum ctAbstract = (CTAbstractNum) XmlBeans.getContextTypeLoader()
                .newInstance(CTAbstractNum.type, null);
        ctAbstract.setAbstractNumId(abstractId);
        for (int i = 0; i < LEVELS; i++) {
            CTLvl lvl = ctAbstract.addNewLvl();
            lvl.setIlvl(BigInteger.valueOf(i));
            lvl.addNewStart().setVal(BigInteger.ONE);
            if (listType == ListType.BULLET) {
                lvl.addNewNumFmt().setVal(STNumberFormat.BULLET);
                lvl.addNewLvlText().setVal("•");
            } else {
                lvl.addNewNumFmt().setVal(STNumberFormat.DECIMAL);
                lvl.addNewLvlText().setVal("%" + (i + 1) + ".");
            }
        }

        // 3. 注册并生成 numId
        BigInteger absId = numbering.addAbstractNum(new XWPFAbstractNum(ctAbstract));
        BigInteger numId = numbering.addNum(absId);
        numIds.put(listType, numId);
        log.debug("创建列表编号定义: type={}, abstractNumId={}, numId={}", listType, absId, numId);
        return numId;
    }
}

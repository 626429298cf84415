package com.example.docxtext.util.docx.collect;

import com.example.docxtext.util.docx.model.Paragraph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 把每个表格整理成规则网格
 *
 * <ul>
 *     <li>gridSpan=k 的单元格占 k 个位置，多出的位置复制原单元格（duplicate）或补空白单元格</li>
 *     <li>vMerge 延续单元格在 duplicate 模式下取上一行同一网格列的内容</li>
 *     <li>最后把较短的行用空白单元格补齐，每行单元格数相同</li>
 * </ul>
 * 空白单元格只含一个空段落。
 */
public final class MergedCellNormalizer {

    private MergedCellNormalizer() {
    }

    /**
     * @param tables    遍历得到的 表格-行-单元格-段落 结构
     * @param merges    单元格列表（按对象identity）-> 合并信息
     * @param duplicate 是否复制合并单元格内容
     */
    @SuppressWarnings("unchecked")
    public static List<List<List<List<Paragraph>>>> normalize(List<?> tables, Map<List<?>, CellMerge> merges,
                                                               boolean duplicate) {
        List<List<List<List<Paragraph>>>> result = new ArrayList<>(tables.size());
        for (Object tableObject : tables) {
            List<List<List<Paragraph>>> rows = new ArrayList<>();
            List<List<Paragraph>> above = null;
            for (Object rowObject : (List<?>) tableObject) {
                List<List<Paragraph>> row = new ArrayList<>();
                for (Object cellObject : (List<?>) rowObject) {
                    List<Paragraph> cell = (List<Paragraph>) cellObject;
                    CellMerge merge = merges.getOrDefault(cell, CellMerge.NONE);
                    int gridColumn = row.size();

                    List<Paragraph> content = new ArrayList<>(cell);
                    if (merge.isVerticalContinuation() && duplicate && above != null && gridColumn < above.size()) {
                        content = new ArrayList<>(above.get(gridColumn));
                    }
                    row.add(content);
                    for (int k = 1; k < merge.getGridSpan(); k++) {
                        row.add(duplicate ? new ArrayList<>(content) : blankCell());
                    }
                }
                rows.add(row);
                above = row;
            }
            padRows(rows);
            result.add(rows);
        }
        return result;
    }

    private static void padRows(List<List<List<Paragraph>>> rows) {
        int width = 0;
        for (List<List<Paragraph>> row : rows) {
            width = Math.max(width, row.size());
        }
        for (List<List<Paragraph>> row : rows) {
            while (row.size() < width) {
                row.add(blankCell());
            }
        }
    }

    static List<Paragraph> blankCell() {
        List<Paragraph> cell = new ArrayList<>(1);
        cell.add(Paragraph.blank());
        return cell;
    }
}

package com.careerhub.matchservice.games.careermatch.domain.constants;

import java.util.List;
import java.util.Locale;

/**
 * 翻牌用的职业卡面目录（每局从中抽取 totalPairs 个职业，每个职业两张牌）。
 */
public final class CareerCatalog {

    private CareerCatalog() {
    }

    /** 卡面图片目录 */
    public static final String IMAGE_DIR = "/assets/Discovered Live/Role - Landscape/";

    public static final List<String> CAREERS = List.of(
            "3D Artist", "Accountant", "Auditor", "Broadcast Engineer", "Camera Operator",
            "Civil Engineer", "Coach", "Composer", "Conductor", "Content Writer",
            "Costume Designer", "Data Scientist", "Dentist", "Educator", "Electrician",
            "Engineer", "Event Planner", "Fashion Buyer", "Financial Analyst", "Fitness Trainer",
            "Geologist", "Graphic Designer", "IT Specialist", "Interior Designer", "Judge",
            "Makeup Artist", "Marketing Manager", "Mechanical Engineer", "Music Producer", "Nurse",
            "Nutritionist", "Operations Manager", "Paramedic", "Pastry Chef", "Pharmacist",
            "Photographer", "Physical Therapist", "Pilot", "Plumber", "Politician",
            "Producer", "Public Relations Specialist", "Radiologic Technologist", "Real Estate Agent", "Researcher",
            "Set Designer", "Software Engineer", "Talent Scout", "UX Designer", "Veterinarian"
    );

    public static String imagePath(String career) {
        return IMAGE_DIR + career + ".png";
    }

    /**
     * 卡对 ID：职业名小写连字符 + 序号，如 "pastry-chef-3"。
     */
    public static String pairId(String career, int seq) {
        String slug = career.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return slug + "-" + seq;
    }
}
